package pt.raidline.eventual.queue;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * A place where units of work are submitted and eventually run.
 * <p>
 * Work submitted with {@link #submit(Runnable)} to one queue runs in submission order.
 * Nothing is promised about which thread runs it.
 */
public interface ExecutionQueue {

    /**
     * Enqueues {@code work} to run as soon as the queue gets to it. Never blocks.
     *
     * @param work the unit of work
     */
    void submit(Runnable work);

    /**
     * Enqueues {@code work} to run once {@code delay} has elapsed.
     *
     * @param work  the unit of work
     * @param delay how long to wait before enqueueing, not negative
     * @return a handle that prevents the work from running if cancelled in time
     */
    Cancellable schedule(Runnable work, Duration delay);

    /**
     * Adapts a caller-owned executor. Its lifecycle stays with the caller.
     *
     * @param executor the executor to submit to
     * @return a queue backed by {@code executor}
     */
    static ExecutionQueue wrap(ScheduledExecutorService executor) {
        return new ExecutorQueue(executor);
    }
}
