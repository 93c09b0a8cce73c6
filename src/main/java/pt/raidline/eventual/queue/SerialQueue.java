package pt.raidline.eventual.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A FIFO queue served by one dedicated thread.
 * <p>
 * Work runs one item at a time, in submission order. Delayed work joins the queue when its
 * delay elapses. The queue owns its thread, so callers must {@link #close()} it.
 *
 * <pre>{@code
 * try (SerialQueue queue = SerialQueue.create(SerialQueueConfig.named("io"))) {
 *     Future<String> page = Future.create(queue, done -> done.succeed(fetch()));
 *     ...
 * }
 * }</pre>
 */
public final class SerialQueue extends ExecutorQueue implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SerialQueue.class);

    private final SerialQueueConfig config;

    private SerialQueue(SerialQueueConfig config, ScheduledThreadPoolExecutor executor) {
        super(executor);
        this.config = config;
    }

    public static SerialQueue create(SerialQueueConfig config) {
        Objects.requireNonNull(config, "config cannot be null");

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, work -> {
            Thread thread = new Thread(work, config.label());
            thread.setDaemon(config.daemon());
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

        log.debug("Serial queue [{}] started (daemon={})", config.label(), config.daemon());
        return new SerialQueue(config, executor);
    }

    public static SerialQueue named(String label) {
        return create(SerialQueueConfig.named(label));
    }

    public String label() {
        return config.label();
    }

    public boolean isClosed() {
        return executor().isShutdown();
    }

    /**
     * Stops accepting work and drops pending delayed work. Work already queued still runs.
     */
    @Override
    public void close() {
        executor().shutdown();
        log.debug("Serial queue [{}] closed", config.label());
    }

    /**
     * Closes the queue and waits for queued work to finish.
     *
     * @return {@code true} if the worker finished within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean closeAndAwait(long timeout, TimeUnit unit) throws InterruptedException {
        close();
        return executor().awaitTermination(timeout, unit);
    }

    @Override
    public String toString() {
        return "SerialQueue[" + config.label() + "]";
    }
}
