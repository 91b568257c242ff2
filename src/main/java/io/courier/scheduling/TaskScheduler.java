package io.courier.scheduling;

import java.time.Duration;

/**
 * Runs deferred work without blocking the caller: request deadlines, retry backoff and throttle waits.
 */
public interface TaskScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    interface ScheduledTask {
        /**
         * @return true when the task had not run yet and will not run
         */
        boolean cancel();
    }
}
