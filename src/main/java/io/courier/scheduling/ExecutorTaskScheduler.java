package io.courier.scheduling;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
    private final ScheduledExecutorService executor;
    private final boolean owned;

    public ExecutorTaskScheduler(String threadName) {
        this(Executors.newSingleThreadScheduledExecutor(daemonThreads(threadName)), true);
    }

    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this(executor, false);
    }

    private ExecutorTaskScheduler(ScheduledExecutorService executor, boolean owned) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.owned = owned;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        long delayMs = delay == null || delay.isNegative() ? 0L : delay.toMillis();
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        if (owned) {
            executor.shutdownNow();
        }
    }

    public static ThreadFactory daemonThreads(String baseName) {
        String name = baseName == null || baseName.isBlank() ? "courier" : baseName.trim();
        AtomicInteger seq = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
