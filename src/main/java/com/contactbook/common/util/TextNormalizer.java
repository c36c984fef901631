package com.contactbook.common.util;

import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;

/**
 * 入参文本规整：去掉首尾空白后再按长度约束校验。
 * <p>
 * 请求对象上的 {@code @Size} 作用于原始字符串，去空白后长度可能跌出范围，入库前需以规整后的值为准。
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String trimToLength(String value, String field, int min, int max) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() < min || trimmed.length() > max) {
            throw new BusinessException(ErrorCode.BAD_REQUEST,
                    field + ": size must be between " + min + " and " + max);
        }
        return trimmed;
    }
}
