package pt.raidline.eventual.sync;

/**
 * An integer counter whose increments and decrements are atomic with respect to each other.
 * Backed by a {@link Guarded} cell.
 */
public final class GuardedCounter {
    private final Guarded<Integer> count;

    public GuardedCounter() {
        this(0);
    }

    public GuardedCounter(int initial) {
        this.count = new Guarded<>(initial);
    }

    public int incrementAndGet() {
        return count.updateAndGet(n -> n + 1);
    }

    public int decrementAndGet() {
        return count.updateAndGet(n -> n - 1);
    }

    public int get() {
        return count.get();
    }

    @Override
    public String toString() {
        return String.valueOf(count.get());
    }
}
