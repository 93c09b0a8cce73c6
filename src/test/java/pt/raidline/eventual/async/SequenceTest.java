package pt.raidline.eventual.async;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pt.raidline.eventual.Failure;
import pt.raidline.eventual.Try;
import pt.raidline.eventual.queue.ManualQueue;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

@DisplayName("Future.sequence()")
class SequenceTest {

    private ManualQueue queue;

    @BeforeEach
    void setUp() {
        queue = new ManualQueue();
    }

    @Test
    @DisplayName("should collect values in input order regardless of completion order")
    void shouldKeepInputOrder() {
        AtomicReference<Completion<String>> first = new AtomicReference<>();
        AtomicReference<Completion<String>> second = new AtomicReference<>();
        AtomicReference<Completion<String>> third = new AtomicReference<>();

        var all = Future.sequence(queue, List.of(
                Future.create(queue, first::set),
                Future.create(queue, second::set),
                Future.create(queue, third::set)));
        queue.runPending();

        third.get().succeed("c");
        first.get().succeed("a");
        queue.runPending();
        assertFalse(all.isCompleted());

        second.get().succeed("b");
        queue.runPending();
        assertEquals(Try.success(List.of("a", "b", "c")), all.value().orElseThrow());
    }

    @Test
    @DisplayName("should fail with the first failure")
    void shouldFailWithFirstFailure() {
        IOException error = new IOException("one of them failed");

        var all = Future.sequence(queue, List.of(
                Future.success(queue, 1),
                Future.<Integer>failed(queue, error),
                Future.success(queue, 3)));
        queue.runPending();

        assertSame(error, ((Failure<List<Integer>>) all.value().orElseThrow()).error());
    }

    @Test
    @DisplayName("should succeed with an empty list when there is nothing to wait for")
    void shouldSucceedOnEmptyInput() {
        var all = Future.<String>sequence(queue, List.of());
        queue.runPending();

        assertEquals(Try.success(List.of()), all.value().orElseThrow());
    }
}
