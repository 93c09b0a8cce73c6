package pt.raidline.eventual.queue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SerialQueue")
class SerialQueueTest {

    private final SerialQueue queue = SerialQueue.named("serial-test");

    @AfterEach
    void tearDown() {
        queue.close();
    }

    @Test
    @DisplayName("should run submitted work in FIFO order on its own named thread")
    void shouldRunInOrderOnNamedThread() throws InterruptedException {
        List<String> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(100);

        for (int i = 0; i < 100; i++) {
            int n = i;
            queue.submit(() -> {
                seen.add(n + "@" + Thread.currentThread().getName());
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 100; i++) {
            assertEquals(i + "@serial-test", seen.get(i));
        }
    }

    @Test
    @DisplayName("should run delayed work after the delay")
    void shouldRunDelayedWork() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);
        long start = System.nanoTime();

        queue.schedule(fired::countDown, Duration.ofMillis(50));

        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 45);
    }

    @Test
    @DisplayName("should not run cancelled delayed work")
    void shouldNotRunCancelledWork() throws InterruptedException {
        CountDownLatch fired = new CountDownLatch(1);

        Cancellable timer = queue.schedule(fired::countDown, Duration.ofMillis(100));

        assertTrue(timer.cancel());
        assertFalse(fired.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("should reject a negative delay")
    void shouldRejectNegativeDelay() {
        assertThrows(IllegalArgumentException.class, () -> queue.schedule(() -> {
        }, Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("should finish queued work when closed and awaited")
    void shouldFinishQueuedWorkOnClose() throws InterruptedException {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        queue.submit(() -> seen.add(1));
        queue.submit(() -> seen.add(2));

        assertTrue(queue.closeAndAwait(5, TimeUnit.SECONDS));
        assertTrue(queue.isClosed());
        assertEquals(List.of(1, 2), seen);
    }

    @Test
    @DisplayName("config should reject a blank label")
    void configShouldRejectBlankLabel() {
        assertThrows(IllegalArgumentException.class, () -> new SerialQueueConfig(" ", true));
        assertThrows(IllegalArgumentException.class, () -> SerialQueueConfig.named(null));
        assertTrue(SerialQueueConfig.named("io").daemon());
    }
}
