package pt.raidline.eventual.async;

import pt.raidline.eventual.Try;

/**
 * The one-shot handle a {@link Producer} uses to deliver its result.
 * <p>
 * Only the first call has an effect; later calls are ignored.
 *
 * @param <R> the type of the success value
 */
@FunctionalInterface
public interface Completion<R> {

    void complete(Try<R> result);

    default void succeed(R value) {
        complete(Try.success(value));
    }

    default void fail(Exception error) {
        complete(Try.failure(error));
    }
}
