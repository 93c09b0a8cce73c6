package pt.raidline.eventual;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value that is either a {@link Left} or a {@link Right}.
 * <p>
 * Used by {@code Future.or} to tell which side of a race produced the result.
 *
 * @param <L> the left type
 * @param <R> the right type
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {

    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    default boolean isLeft() {
        return this instanceof Left<L, R>;
    }

    default boolean isRight() {
        return this instanceof Right<L, R>;
    }

    default <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
        if (this instanceof Left<L, R> left) {
            return onLeft.apply(left.value());
        }
        return onRight.apply(((Right<L, R>) this).value());
    }

    record Left<L, R>(L value) implements Either<L, R> {
        public Left {
            Objects.requireNonNull(value, "left value cannot be null");
        }
    }

    record Right<L, R>(R value) implements Either<L, R> {
        public Right {
            Objects.requireNonNull(value, "right value cannot be null");
        }
    }
}
