package pt.raidline.eventual.async;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pt.raidline.eventual.Either;
import pt.raidline.eventual.Failure;
import pt.raidline.eventual.Try;
import pt.raidline.eventual.queue.ManualQueue;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("or()")
class OrTest {

    private ManualQueue queue;

    @BeforeEach
    void setUp() {
        queue = new ManualQueue();
    }

    private <T> Future<T> after(Duration delay, T value) {
        return Future.create(queue, done -> queue.schedule(() -> done.succeed(value), delay));
    }

    @Test
    @DisplayName("should yield the right side when it completes first")
    void shouldYieldRightWhenFaster() {
        Future<Integer> slow = after(Duration.ofMillis(100), 1);
        Future<String> fast = after(Duration.ofMillis(10), "b");

        var race = slow.or(fast);
        queue.advance(Duration.ofMillis(200));

        assertEquals(Try.success(Either.right("b")), race.value().orElseThrow());
    }

    @Test
    @DisplayName("should yield the left side when it completes first")
    void shouldYieldLeftWhenFaster() {
        Future<Integer> fast = after(Duration.ofMillis(10), 1);
        Future<String> slow = after(Duration.ofMillis(100), "b");

        var race = fast.or(slow);
        queue.advance(Duration.ofMillis(200));

        assertEquals(Try.success(Either.left(1)), race.value().orElseThrow());
        assertEquals(Try.success("b"), slow.value().orElseThrow());
    }

    @Test
    @DisplayName("should let an earlier failure win the race")
    void shouldLetFailureWin() {
        IOException error = new IOException("fast failure");
        Future<Integer> failing = Future.create(queue, done ->
                queue.schedule(() -> done.fail(error), Duration.ofMillis(5)));
        Future<String> slow = after(Duration.ofMillis(50), "b");

        var race = failing.or(slow);
        queue.advance(Duration.ofMillis(100));

        assertSame(error, ((Failure<Either<Integer, String>>) race.value().orElseThrow()).error());
    }

    @Test
    @DisplayName("should ignore a result that arrives after the winner")
    void shouldIgnoreLateResult() {
        AtomicReference<Completion<String>> late = new AtomicReference<>();
        Future<String> lateFuture = Future.create(queue, late::set);

        var race = Future.success(queue, 1).or(lateFuture);
        queue.runPending();
        late.get().fail(new IOException("too late"));
        queue.runPending();

        assertEquals(Try.success(Either.left(1)), race.value().orElseThrow());
    }
}
