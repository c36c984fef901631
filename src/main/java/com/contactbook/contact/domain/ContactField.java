package com.contactbook.contact.domain;

import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Optional;

/**
 * 允许按字段检索的联系人属性白名单。
 * <p>
 * 对外名称与数据库列名一一对应；查询值先按字段类型解析，SQL 中只会出现这里声明的列名。
 */
public enum ContactField {

    FIRST_NAME("first_name"),
    LAST_NAME("last_name"),
    EMAIL("email"),
    PHONE("phone"),
    BIRTH_DATE("birth_date") {
        @Override
        public Object parseValue(String raw) {
            try {
                return LocalDate.parse(raw.trim());
            } catch (DateTimeParseException ex) {
                throw new BusinessException(ErrorCode.INVALID_FIELD_VALUE, "Invalid date, expected YYYY-MM-DD");
            }
        }
    };

    private final String column;

    ContactField(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    public static Optional<ContactField> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(field -> field.column.equals(name))
                .findFirst();
    }

    public static ContactField require(String name) {
        return fromName(name).orElseThrow(() -> new BusinessException(ErrorCode.INVALID_FIELD_NAME));
    }

    public Object parseValue(String raw) {
        if (raw == null) {
            throw new BusinessException(ErrorCode.INVALID_FIELD_VALUE);
        }
        return raw;
    }
}
