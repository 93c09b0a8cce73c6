package pt.raidline.eventual.sync;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * A mutable cell whose writes are serialized by an exclusive lock.
 * <p>
 * Reads are lock-free and see the latest completed write. Every write, and every
 * read-modify-write, holds the lock for the duration of a single field update. The lock is
 * reentrant, so {@link #locked(Supplier)} can group a read and a write into one critical section.
 * <p>
 * Never invoke user callbacks while holding the lock.
 *
 * @param <V> the type of the guarded value
 */
public final class Guarded<V> {
    private final ReentrantLock lock = new ReentrantLock();
    private volatile V value;

    public Guarded(V initial) {
        this.value = initial;
    }

    public V get() {
        return value;
    }

    public void set(V newValue) {
        lock.lock();
        try {
            value = newValue;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the value and returns the one it replaced.
     */
    public V getAndSet(V newValue) {
        lock.lock();
        try {
            V previous = value;
            value = newValue;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies {@code update} to the current value and stores the result atomically.
     *
     * @param update a side-effect free function of the current value
     * @return the stored value
     */
    public V updateAndGet(UnaryOperator<V> update) {
        Objects.requireNonNull(update, "update cannot be null");

        lock.lock();
        try {
            value = update.apply(value);
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code section} while holding this cell's lock.
     * <p>
     * The section may call {@link #get()} and {@link #set(Object)}, and may touch state that is
     * only ever accessed under this lock.
     *
     * @param section the critical section, O(1) and free of callbacks
     * @param <T>     the result type
     * @return the section's result
     */
    public <T> T locked(Supplier<T> section) {
        Objects.requireNonNull(section, "section cannot be null");

        lock.lock();
        try {
            return section.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Guarded[" + value + "]";
    }
}
