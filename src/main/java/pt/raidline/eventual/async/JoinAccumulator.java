package pt.raidline.eventual.async;

import pt.raidline.eventual.sync.Guarded;
import pt.raidline.eventual.sync.GuardedCounter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Collects one value per slot and fires {@code onComplete} once every slot has been filled.
 * <p>
 * Pushes may come from any thread. The terminal callback runs on the thread of the last push,
 * exactly once, with the values in slot order. Pushing to the same slot twice counts twice;
 * callers push each slot at most once.
 *
 * @param <T> the slot value type
 */
final class JoinAccumulator<T> {
    private final int arity;
    private final Guarded<List<T>> slots;
    private final GuardedCounter filled = new GuardedCounter();
    private final Consumer<List<T>> onComplete;

    JoinAccumulator(int arity, Consumer<List<T>> onComplete) {
        if (arity <= 0) {
            throw new IllegalArgumentException("arity must be positive (current: " + arity + ")");
        }
        this.arity = arity;
        List<T> empty = new ArrayList<>(Collections.nCopies(arity, null));
        this.slots = new Guarded<>(empty);
        this.onComplete = Objects.requireNonNull(onComplete, "onComplete cannot be null");
    }

    void push(int slot, T value) {
        Objects.checkIndex(slot, arity);
        Objects.requireNonNull(value, "value cannot be null");

        slots.locked(() -> slots.get().set(slot, value));
        if (filled.incrementAndGet() == arity) {
            onComplete.accept(slots.locked(() -> List.copyOf(slots.get())));
        }
    }

    int filled() {
        return filled.get();
    }
}
