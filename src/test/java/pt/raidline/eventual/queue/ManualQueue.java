package pt.raidline.eventual.queue;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic {@link ExecutionQueue} for tests.
 * <p>
 * Nothing runs until the test calls {@link #runPending()} or {@link #advance(Duration)}. Delayed
 * work is driven by a virtual clock that only moves through {@link #advance(Duration)}.
 */
public final class ManualQueue implements ExecutionQueue {
    private static final int MAX_STEPS = 100_000;

    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final List<Timer> timers = new ArrayList<>();
    private Duration now = Duration.ZERO;
    private long sequence;

    private record Timer(Duration due, long order, Runnable work) {
    }

    @Override
    public synchronized void submit(Runnable work) {
        ready.add(Objects.requireNonNull(work));
    }

    @Override
    public synchronized Cancellable schedule(Runnable work, Duration delay) {
        Timer timer = new Timer(now.plus(delay), sequence++, Objects.requireNonNull(work));
        timers.add(timer);
        return () -> {
            synchronized (ManualQueue.this) {
                return timers.remove(timer);
            }
        };
    }

    /**
     * Runs queued work, including work it enqueues, until the queue is empty.
     *
     * @return how many units of work ran
     */
    public int runPending() {
        int steps = 0;
        while (true) {
            Runnable next;
            synchronized (this) {
                next = ready.poll();
            }
            if (next == null) {
                return steps;
            }
            if (++steps > MAX_STEPS) {
                throw new IllegalStateException("queue did not drain after " + MAX_STEPS + " steps");
            }
            next.run();
        }
    }

    /**
     * Moves the virtual clock forward, firing due timers in deadline order and draining the
     * queue after each one.
     */
    public void advance(Duration by) {
        Duration target = now.plus(by);
        runPending();
        while (true) {
            Timer due;
            synchronized (this) {
                due = timers.stream()
                        .filter(t -> t.due().compareTo(target) <= 0)
                        .min(Comparator.comparing(Timer::due).thenComparingLong(Timer::order))
                        .orElse(null);
                if (due == null) {
                    now = target;
                    break;
                }
                timers.remove(due);
                now = due.due();
                ready.add(due.work());
            }
            runPending();
        }
        runPending();
    }

    public synchronized int pendingCount() {
        return ready.size();
    }

    public synchronized int timerCount() {
        return timers.size();
    }

    public synchronized Duration elapsed() {
        return now;
    }
}
