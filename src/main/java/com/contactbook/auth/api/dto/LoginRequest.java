package com.contactbook.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 登录请求。`username` 字段承载登录邮箱。
 */
public record LoginRequest(
        @NotBlank String username,
        @NotBlank String password
) {
}
