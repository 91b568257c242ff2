package io.courier.client;

import io.courier.protocol.Response;
import io.courier.scheduling.TaskScheduler;

final class PendingRequest {
    private final String requestId;
    private final String action;
    private final long createdAtMs;
    private final long deadlineMs;
    private final Completion<Response> completion;
    private volatile TaskScheduler.ScheduledTask timeoutTask;

    PendingRequest(String requestId, String action, long createdAtMs, long deadlineMs, Completion<Response> completion) {
        this.requestId = requestId;
        this.action = action;
        this.createdAtMs = createdAtMs;
        this.deadlineMs = deadlineMs;
        this.completion = completion;
    }

    String requestId() {
        return requestId;
    }

    String action() {
        return action;
    }

    long createdAtMs() {
        return createdAtMs;
    }

    long deadlineMs() {
        return deadlineMs;
    }

    Completion<Response> completion() {
        return completion;
    }

    void timeoutTask(TaskScheduler.ScheduledTask task) {
        this.timeoutTask = task;
    }

    void cancelTimeout() {
        TaskScheduler.ScheduledTask task = timeoutTask;
        if (task != null) {
            task.cancel();
        }
    }
}
