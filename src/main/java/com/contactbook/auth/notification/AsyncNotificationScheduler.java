package com.contactbook.auth.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring {@link TaskExecutor} 的通知调度实现。
 * <p>
 * 通知以后台任务方式发送，调用线程不等待结果；发送或提交失败只记录错误日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncNotificationScheduler implements NotificationScheduler {

    private final TaskExecutor taskExecutor;
    private final ConfirmationSender confirmationSender;

    @Override
    public void schedule(ConfirmationNotice notice) {
        try {
            taskExecutor.execute(() -> deliver(notice));
        } catch (TaskRejectedException ex) {
            log.error("Confirmation notice rejected by executor, email={}", notice.email(), ex);
        }
    }

    private void deliver(ConfirmationNotice notice) {
        try {
            confirmationSender.send(notice);
        } catch (RuntimeException ex) {
            log.error("Failed to send confirmation email to {}", notice.email(), ex);
        }
    }
}
