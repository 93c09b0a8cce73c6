package pt.raidline.eventual.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExecutionQueue} over a {@link ScheduledExecutorService}.
 * <p>
 * Submission order is only preserved if the executor itself runs tasks in order, as a
 * single-threaded executor does.
 */
public class ExecutorQueue implements ExecutionQueue {
    private final ScheduledExecutorService executor;

    public ExecutorQueue(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
    }

    @Override
    public void submit(Runnable work) {
        Objects.requireNonNull(work, "work cannot be null");
        executor.execute(work);
    }

    @Override
    public Cancellable schedule(Runnable work, Duration delay) {
        Objects.requireNonNull(work, "work cannot be null");
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative (current: " + delay + ")");
        }

        // saturates at Long.MAX_VALUE instead of overflowing
        long nanos = TimeUnit.NANOSECONDS.convert(delay);
        ScheduledFuture<?> scheduled = executor.schedule(work, nanos, TimeUnit.NANOSECONDS);
        return () -> scheduled.cancel(false);
    }

    protected ScheduledExecutorService executor() {
        return executor;
    }
}
