package com.contactbook.auth.notification;

import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AsyncNotificationSchedulerTest {

    private final ConfirmationNotice notice =
            new ConfirmationNotice("alice@example.com", "alice01", "http://localhost:8080");

    @Test
    void deliversThroughExecutor() {
        List<ConfirmationNotice> sent = new ArrayList<>();
        AsyncNotificationScheduler scheduler = new AsyncNotificationScheduler(new SyncTaskExecutor(), sent::add);

        scheduler.schedule(notice);

        assertThat(sent).containsExactly(notice);
    }

    @Test
    void senderFailureDoesNotReachCaller() {
        ConfirmationSender failing = n -> {
            throw new IllegalStateException("smtp down");
        };
        AsyncNotificationScheduler scheduler = new AsyncNotificationScheduler(new SyncTaskExecutor(), failing);

        assertThatCode(() -> scheduler.schedule(notice)).doesNotThrowAnyException();
    }

    @Test
    void rejectedTaskDoesNotReachCaller() {
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("queue full");
        };
        List<ConfirmationNotice> sent = new ArrayList<>();
        AsyncNotificationScheduler scheduler = new AsyncNotificationScheduler(rejecting, sent::add);

        assertThatCode(() -> scheduler.schedule(notice)).doesNotThrowAnyException();
        assertThat(sent).isEmpty();
    }
}
