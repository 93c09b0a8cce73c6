package pt.raidline.eventual;

import java.util.Objects;

public record Success<R>(R value) implements Try<R> {

    public Success {
        Objects.requireNonNull(value, "You cannot pass a [null] value as a success");
    }
}
