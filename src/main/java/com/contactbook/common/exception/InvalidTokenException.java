package com.contactbook.common.exception;

/**
 * 令牌解码失败。
 *
 * <p>签名错误、过期、类型不符统一使用同一文案，不向调用方暴露具体失败环节。</p>
 */
public class InvalidTokenException extends BusinessException {

    public InvalidTokenException() {
        super(ErrorCode.INVALID_TOKEN);
    }

    public InvalidTokenException(Throwable cause) {
        super(ErrorCode.INVALID_TOKEN, cause);
    }
}
