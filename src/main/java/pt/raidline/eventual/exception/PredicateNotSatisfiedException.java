package pt.raidline.eventual.exception;

import java.util.NoSuchElementException;

/**
 * Raised by {@code filter} when the predicate rejects a success value.
 */
public class PredicateNotSatisfiedException extends NoSuchElementException {
    private final transient Object value;

    public PredicateNotSatisfiedException(Object value) {
        super("Predicate does not hold for " + value);
        this.value = value;
    }

    public Object value() {
        return value;
    }
}
