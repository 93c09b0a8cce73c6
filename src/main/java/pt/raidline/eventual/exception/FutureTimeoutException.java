package pt.raidline.eventual.exception;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Raised by {@code Future.timeout} when the source did not complete before the deadline.
 */
public class FutureTimeoutException extends TimeoutException {
    private final Duration timeout;
    private final Instant deadline;

    public FutureTimeoutException(Duration timeout, Instant deadline) {
        super("Future did not complete within " + timeout + " (deadline " + deadline + ")");
        this.timeout = timeout;
        this.deadline = deadline;
    }

    public Duration timeout() {
        return timeout;
    }

    public Instant deadline() {
        return deadline;
    }
}
