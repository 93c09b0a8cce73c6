package pt.raidline.eventual;

import pt.raidline.eventual.exception.PredicateNotSatisfiedException;
import pt.raidline.eventual.lambdas.Throwing;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A value that represents a computation that either succeeded with a value of type {@code R}
 * or failed with an {@link Exception}. Similar to Scala's {@code Try}.
 * <p>
 * {@code Try} is a sealed interface with two permitted implementations:
 * <ul>
 *   <li>{@link Success} - the computation produced a value</li>
 *   <li>{@link Failure} - the computation produced an error</li>
 * </ul>
 * Instances are immutable and can be shared freely between threads.
 *
 * <h2>Key Features</h2>
 * <ul>
 *   <li>Errors are carried as values instead of being thrown</li>
 *   <li>Functional composition with {@link #map}, {@link #transform} and {@link #flatMap}</li>
 *   <li>Recovery with {@link #handle} and {@link #rescue}</li>
 *   <li>{@link #get()} is the only operation that turns a failure back into a thrown exception</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Basic Usage</h3>
 * <pre>{@code
 * Try<String> success = Try.success("Hello");
 * Try<String> failure = Try.failure(new IOException("File not found"));
 *
 * // Wrapping exception-throwing code
 * Try<Integer> parsed = Try.of(() -> Integer.parseInt("42"));
 * }</pre>
 *
 * <h3>Transformation and Recovery</h3>
 * <pre>{@code
 * Try<User> user = Try.of(() -> repository.findById(id))
 *     .filter(User::isActive)
 *     .transform(this::validate)
 *     .rescue(error -> cache.lookup(id));
 * }</pre>
 *
 * @param <R> the type of the success value
 * @see Success
 * @see Failure
 */
public sealed interface Try<R> permits Failure, Success {

    /**
     * Lifts a potentially throwing computation into a {@code Try}.
     * <p>
     * If the computation returns, the result is a {@link Success} holding the value.
     * If it throws, the result is a {@link Failure} holding the exception.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Try<Integer> parsed = Try.of(() -> Integer.parseInt("42"));
     * // Success(42)
     *
     * Try<Integer> failed = Try.of(() -> Integer.parseInt("not-a-number"));
     * // Failure(NumberFormatException)
     * }</pre>
     *
     * @param throwing the computation that may throw
     * @param <R>      the type of the success value
     * @return a {@link Success} if the computation returns, or a {@link Failure} if it throws
     */
    static <R> Try<R> of(Throwing<R> throwing) {
        Objects.requireNonNull(throwing, "throwing computation cannot be null");
        try {
            return success(throwing.get());
        } catch (Exception ex) {
            return failure(ex);
        }
    }

    /**
     * Creates a {@link Success} containing the given value.
     *
     * @param value the success value (must not be null)
     * @param <R>   the type of the success value
     * @return a {@link Success} containing the value
     * @throws NullPointerException if value is null
     */
    static <R> Try<R> success(R value) {
        Objects.requireNonNull(value, "You cannot pass a [null] value as a success");
        return new Success<>(value);
    }

    /**
     * Creates a {@link Failure} containing the given error.
     *
     * @param error the error (must not be null)
     * @param <R>   the type of the success value
     * @return a {@link Failure} containing the error
     * @throws NullPointerException if error is null
     */
    static <R> Try<R> failure(Exception error) {
        Objects.requireNonNull(error, "You cannot pass a [null] value as an error");
        return new Failure<>(error);
    }

    /**
     * @return {@code true} if this is a {@link Success}
     */
    default boolean isSuccess() {
        return this instanceof Success<R>;
    }

    /**
     * @return {@code true} if this is a {@link Failure}
     */
    default boolean isFailure() {
        return this instanceof Failure<R>;
    }

    /**
     * Runs {@code action} with the value if this is a {@link Success}.
     *
     * @param action the side effect to run
     * @return this, unchanged
     */
    default Try<R> onSuccess(Consumer<? super R> action) {
        Objects.requireNonNull(action, "action cannot be null");

        if (this instanceof Success<R> success) {
            action.accept(success.value());
        }
        return this;
    }

    /**
     * Runs {@code action} with the error if this is a {@link Failure}.
     *
     * @param action the side effect to run
     * @return this, unchanged
     */
    default Try<R> onFailure(Consumer<? super Exception> action) {
        Objects.requireNonNull(action, "action cannot be null");

        if (this instanceof Failure<R> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    /**
     * Same as {@link #onSuccess}, without the chaining result.
     *
     * @param action the side effect to run with the success value
     */
    default void foreach(Consumer<? super R> action) {
        onSuccess(action);
    }

    /**
     * Returns the success value, or {@code defaultValue} if this is a failure.
     *
     * @param defaultValue the value returned on failure
     * @return the success value or the default
     */
    default R getOrElse(R defaultValue) {
        if (this instanceof Success<R> success) {
            return success.value();
        }
        return defaultValue;
    }

    /**
     * Extracts the success value, rethrowing the stored error if this is a failure.
     * <p>
     * This is the boundary where a {@link Failure} turns back into control flow. The stored
     * exception instance is thrown as is, without wrapping.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Try.success("hello").get();                      // "hello"
     * Try.failure(new IOException("disk")).get();      // throws IOException("disk")
     * }</pre>
     *
     * @return the success value
     * @throws Exception the stored error if this is a Failure
     */
    default R get() throws Exception {
        if (this instanceof Failure<R> failure) {
            throw failure.error();
        }
        return ((Success<R>) this).value();
    }

    /**
     * Applies one of two functions depending on the variant.
     *
     * @param onSuccess applied to the value of a Success
     * @param onFailure applied to the error of a Failure
     * @param <T>       the result type
     * @return the result of the applied function
     */
    default <T> T fold(Function<? super R, ? extends T> onSuccess,
                       Function<? super Exception, ? extends T> onFailure) {
        if (this instanceof Success<R> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(((Failure<R>) this).error());
    }

    /**
     * Chains a {@code Try}-returning operation. This is the foundational operator of the algebra.
     * <p>
     * If this is a {@link Success}, the result of {@code mapper} applied to the value is returned.
     * If this is a {@link Failure}, the failure is returned and {@code mapper} is not invoked.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Try<User> saved = findUser("123")
     *     .transform(user -> validate(user))
     *     .transform(user -> save(user));
     * }</pre>
     *
     * @param mapper the function to apply to the success value
     * @param <R2>   the new success type
     * @return the result of the mapper, or the original failure
     */
    @SuppressWarnings("unchecked")
    default <R2> Try<R2> transform(Function<? super R, ? extends Try<R2>> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");

        if (this instanceof Success<R> success) {
            return mapper.apply(success.value());
        }
        return (Try<R2>) this;
    }

    /**
     * Alias of {@link #transform}.
     *
     * @param mapper the function to apply to the success value
     * @param <R2>   the new success type
     * @return the result of the mapper, or the original failure
     */
    default <R2> Try<R2> flatMap(Function<? super R, ? extends Try<R2>> mapper) {
        return transform(mapper);
    }

    /**
     * Transforms the success value.
     * <p>
     * A failure is returned unchanged and {@code mapper} is not invoked. If {@code mapper}
     * throws or returns {@code null}, the result is a {@link Failure} holding that exception.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Try<Integer> length = Try.success("hello").map(String::length);
     * // Success(5)
     * }</pre>
     *
     * @param mapper the function to apply to the success value
     * @param <R2>   the type of the mapped value
     * @return a new {@link Success} with the mapped value, or a {@link Failure}
     */
    default <R2> Try<R2> map(Function<? super R, ? extends R2> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");

        return transform(value -> of(() -> mapper.apply(value)));
    }

    /**
     * Converts a failure into a success by applying {@code recovery} to the error.
     * A success is returned unchanged.
     *
     * @param recovery the function producing a replacement value
     * @return this if Success, otherwise a Success holding the recovered value
     */
    default Try<R> handle(Function<? super Exception, ? extends R> recovery) {
        Objects.requireNonNull(recovery, "recovery cannot be null");

        return rescue(error -> success(recovery.apply(error)));
    }

    /**
     * Recovers from a failure with a function that may itself fail.
     * A success is returned unchanged.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Try<Config> config = loadPrimary()
     *     .rescue(error -> loadFallback());
     * }</pre>
     *
     * @param recovery the function applied to the error
     * @return this if Success, otherwise the result of the recovery function
     */
    default Try<R> rescue(Function<? super Exception, ? extends Try<R>> recovery) {
        Objects.requireNonNull(recovery, "recovery cannot be null");

        if (this instanceof Failure<R> failure) {
            return recovery.apply(failure.error());
        }
        return this;
    }

    /**
     * Keeps a success only if {@code predicate} holds for its value.
     * <p>
     * A success that does not satisfy the predicate becomes a {@link Failure} holding a
     * {@link PredicateNotSatisfiedException} that names the rejected value.
     * A failure is returned unchanged.
     *
     * @param predicate the predicate to test the success value
     * @return this, or a Failure if the predicate rejects the value
     */
    default Try<R> filter(Predicate<? super R> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");

        return transform(value -> predicate.test(value)
                ? this
                : failure(new PredicateNotSatisfiedException(value)));
    }
}
