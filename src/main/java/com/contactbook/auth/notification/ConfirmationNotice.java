package com.contactbook.auth.notification;

/**
 * 待发送的邮箱确认通知。
 *
 * @param email 收件邮箱
 * @param username 用户名，用于称呼
 * @param baseUrl 服务对外地址，确认链接以此为前缀
 */
public record ConfirmationNotice(String email, String username, String baseUrl) {
}
