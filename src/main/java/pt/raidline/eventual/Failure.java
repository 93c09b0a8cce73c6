package pt.raidline.eventual;

import java.util.Objects;

public record Failure<R>(Exception error) implements Try<R> {

    public Failure {
        Objects.requireNonNull(error, "You cannot pass a [null] value as an error");
    }

    /**
     * Throws the stored error as is.
     *
     * @throws Exception always
     */
    public void raise() throws Exception {
        throw error;
    }

}
