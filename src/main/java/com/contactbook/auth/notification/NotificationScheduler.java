package com.contactbook.auth.notification;

/**
 * 通知调度能力。
 * <p>
 * 认证流程只依赖“安排一次通知”，不关心执行方式；实现必须立即返回，发送失败不回传给调用方。
 */
public interface NotificationScheduler {

    void schedule(ConfirmationNotice notice);
}
