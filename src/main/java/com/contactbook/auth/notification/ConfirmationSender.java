package com.contactbook.auth.notification;

/**
 * 确认邮件发送器接口。
 * <p>
 * 抽象真实投递行为（SMTP 或第三方邮件服务），默认实现仅记录日志。
 */
public interface ConfirmationSender {

    void send(ConfirmationNotice notice);
}
