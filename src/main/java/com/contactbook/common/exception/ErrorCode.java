package com.contactbook.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码。
 *
 * <p>每个错误码绑定稳定的字符串编码、HTTP 状态与默认文案；状态只取四类：
 * 401 未认证、404 不存在、400 请求非法、409 冲突。</p>
 */
@Getter
public enum ErrorCode {

    INVALID_TOKEN("INVALID_TOKEN", HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    INVALID_EMAIL("INVALID_EMAIL", HttpStatus.UNAUTHORIZED, "Invalid email"),
    EMAIL_NOT_CONFIRMED("EMAIL_NOT_CONFIRMED", HttpStatus.UNAUTHORIZED, "Email not confirmed"),
    INVALID_PASSWORD("INVALID_PASSWORD", HttpStatus.UNAUTHORIZED, "Invalid password"),
    REFRESH_TOKEN_INVALID("REFRESH_TOKEN_INVALID", HttpStatus.UNAUTHORIZED, "Invalid refresh token"),

    VERIFICATION_ERROR("VERIFICATION_ERROR", HttpStatus.BAD_REQUEST, "Verification error"),
    INVALID_FIELD_NAME("INVALID_FIELD_NAME", HttpStatus.BAD_REQUEST, "Invalid field name"),
    INVALID_FIELD_VALUE("INVALID_FIELD_VALUE", HttpStatus.BAD_REQUEST, "Invalid field value"),
    INVALID_BIRTH_DATE("INVALID_BIRTH_DATE", HttpStatus.BAD_REQUEST, "Wrong date format. Following format works: YYYY-MM-DD"),
    BAD_REQUEST("BAD_REQUEST", HttpStatus.BAD_REQUEST, "Bad request"),

    CONTACT_NOT_FOUND("CONTACT_NOT_FOUND", HttpStatus.NOT_FOUND, "Not Found"),
    USER_NOT_FOUND("USER_NOT_FOUND", HttpStatus.NOT_FOUND, "User not found"),

    ACCOUNT_EXISTS("ACCOUNT_EXISTS", HttpStatus.CONFLICT, "Account already exists");

    private final String code;
    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(String code, HttpStatus status, String defaultMessage) {
        this.code = code;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }
}
