package pt.raidline.eventual;

import java.util.Objects;

/**
 * Two values produced together, as by {@code Future.join}.
 */
public record Pair<L, R>(L left, R right) {

    public Pair {
        Objects.requireNonNull(left, "left cannot be null");
        Objects.requireNonNull(right, "right cannot be null");
    }
}
