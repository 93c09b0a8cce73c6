package pt.raidline.eventual.async;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pt.raidline.eventual.Either;
import pt.raidline.eventual.Failure;
import pt.raidline.eventual.Pair;
import pt.raidline.eventual.Success;
import pt.raidline.eventual.Try;
import pt.raidline.eventual.exception.FutureTimeoutException;
import pt.raidline.eventual.queue.Cancellable;
import pt.raidline.eventual.queue.ExecutionQueue;
import pt.raidline.eventual.sync.Guarded;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A single-assignment container for a {@link Try} that becomes available later.
 * <p>
 * Every future is bound to an {@link ExecutionQueue} at construction. Its {@link Producer} runs on
 * that queue and delivers the result through a one-shot {@link Completion}. Observers registered
 * with {@link #respond} (and everything built on it) run on the same queue:
 * <ul>
 *   <li>observers registered before completion run after it, in registration order</li>
 *   <li>observers registered after completion are dispatched immediately with the stored result</li>
 *   <li>each observer runs exactly once, and every observer sees the same result</li>
 * </ul>
 * Errors never escape as thrown exceptions. They travel as {@link Failure} values and short-circuit
 * {@link #map}, {@link #flatMap} and {@link #filter}; only {@link #rescue} and {@link #handle} turn
 * a failure back into a success.
 *
 * <h2>Usage Examples</h2>
 *
 * <h3>Chaining dependent steps</h3>
 * <pre>{@code
 * Future<User> user = Future.create(queue, done -> users.fetch(id, done::complete));
 *
 * Future<List<Post>> posts = user
 *     .filter(User::isActive)
 *     .flatMap(u -> postsOf(u))
 *     .rescue(error -> Future.success(queue, List.of()));
 * }</pre>
 *
 * <h3>Combining</h3>
 * <pre>{@code
 * Future<Pair<User, Settings>> both = user.join(settings);
 * Future<Either<Page, Page>> fastest = primary.or(mirror);
 * Future<Page> bounded = primary.timeout(Duration.ofMillis(200), queue);
 * }</pre>
 *
 * <b>Note:</b> {@link #or}, {@link #join} and {@link #timeout} never stop the losing side. Its
 * producer keeps running and any cleanup of its resources is up to the caller.
 *
 * @param <R> the type of the success value
 */
public final class Future<R> {
    private static final Logger log = LoggerFactory.getLogger(Future.class);

    private final ExecutionQueue queue;
    private final Guarded<Try<R>> value = new Guarded<>(null);
    // guarded by value's lock, drained on completion
    private final List<Consumer<? super Try<R>>> callbacks = new ArrayList<>();

    private Future(ExecutionQueue queue) {
        this.queue = queue;
    }

    // ==================== STATIC FACTORY METHODS ====================

    /**
     * Creates a future whose result is delivered by {@code producer}.
     * <p>
     * The producer is submitted to {@code queue} immediately; this method never blocks. If the
     * producer throws before completing, the future fails with the thrown exception.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Future<String> body = Future.create(queue, done ->
     *     client.get(url, (response, error) -> {
     *         if (error != null) done.fail(error);
     *         else done.succeed(response.body());
     *     }));
     * }</pre>
     *
     * @param queue    the queue the producer and every observer run on
     * @param producer the computation that eventually completes the future
     * @param <R>      the value type
     * @return a pending future
     * @throws NullPointerException if queue or producer is null
     */
    public static <R> Future<R> create(ExecutionQueue queue, Producer<R> producer) {
        Objects.requireNonNull(queue, "queue cannot be null");
        Objects.requireNonNull(producer, "producer cannot be null");

        Future<R> future = new Future<>(queue);
        queue.submit(() -> future.run(producer));
        return future;
    }

    /**
     * Creates a future holding a known result. Completion still goes through {@code queue},
     * so it is ordered after work already submitted there.
     *
     * @param queue  the queue to bind to
     * @param result the result to complete with
     * @param <R>    the value type
     * @return a future that completes with {@code result}
     */
    public static <R> Future<R> completed(ExecutionQueue queue, Try<R> result) {
        Objects.requireNonNull(result, "result cannot be null");
        return create(queue, completion -> completion.complete(result));
    }

    public static <R> Future<R> success(ExecutionQueue queue, R value) {
        return completed(queue, Try.success(value));
    }

    public static <R> Future<R> failed(ExecutionQueue queue, Exception error) {
        return completed(queue, Try.failure(error));
    }

    /**
     * Bridges a {@link CompletionStage} into a future bound to {@code queue}.
     * <p>
     * An exceptional stage becomes a failure holding the root cause, with
     * {@link CompletionException} and {@link ExecutionException} wrappers removed.
     *
     * @param queue the queue to bind to
     * @param stage the stage to mirror
     * @param <R>   the value type
     * @return a future that completes when the stage does
     */
    public static <R> Future<R> fromStage(ExecutionQueue queue, CompletionStage<? extends R> stage) {
        Objects.requireNonNull(stage, "stage cannot be null");

        return create(queue, completion -> stage.whenComplete((result, error) -> {
            if (error != null) {
                completion.fail(asException(error));
            } else {
                completion.complete(Try.of(() -> result));
            }
        }));
    }

    /**
     * Waits for every future in {@code futures} and yields their values in input order.
     * <p>
     * Fails as soon as any input fails, with that input's error. The remaining inputs keep running.
     * An empty list succeeds with an empty list.
     *
     * @param queue   the queue the combined future is bound to
     * @param futures the futures to wait for
     * @param <R>     the value type
     * @return a future of all values
     */
    public static <R> Future<List<R>> sequence(ExecutionQueue queue, List<Future<R>> futures) {
        Objects.requireNonNull(futures, "futures cannot be null");

        List<Future<R>> inputs = List.copyOf(futures);
        if (inputs.isEmpty()) {
            return success(queue, List.of());
        }

        return create(queue, completion -> {
            JoinAccumulator<R> accumulator = new JoinAccumulator<>(inputs.size(), completion::succeed);
            for (int i = 0; i < inputs.size(); i++) {
                int slot = i;
                inputs.get(i)
                        .onSuccess(v -> accumulator.push(slot, v))
                        .onFailure(completion::fail);
            }
        });
    }

    // ==================== COMPLETION ====================

    private void run(Producer<R> producer) {
        try {
            producer.produce(this::complete);
        } catch (Exception e) {
            complete(Try.failure(e));
        }
    }

    private void complete(Try<R> result) {
        Objects.requireNonNull(result, "result cannot be null");

        List<Consumer<? super Try<R>>> drained = value.locked(() -> {
            if (value.get() != null) {
                return null;
            }
            value.set(result);
            List<Consumer<? super Try<R>>> pending = List.copyOf(callbacks);
            callbacks.clear();
            return pending;
        });

        if (drained == null) {
            log.debug("{} already completed, ignoring {}", this, result);
            return;
        }
        if (!drained.isEmpty()) {
            queue.submit(() -> drained.forEach(callback -> invoke(callback, result)));
        }
    }

    private void invoke(Consumer<? super Try<R>> callback, Try<R> result) {
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            log.warn("Observer of {} threw while handling {}", this, result, e);
        }
    }

    // ==================== OBSERVATION ====================

    /**
     * Registers {@code callback} to run on this future's queue with the eventual result.
     * <p>
     * If the future has already completed, the callback is dispatched right away with the stored
     * result. This is the primitive every combinator is built from.
     *
     * @param callback the observer
     * @return this, to chain further observers
     */
    public Future<R> respond(Consumer<? super Try<R>> callback) {
        Objects.requireNonNull(callback, "callback cannot be null");

        Try<R> current = value.locked(() -> {
            Try<R> existing = value.get();
            if (existing == null) {
                callbacks.add(callback);
            }
            return existing;
        });

        if (current != null) {
            queue.submit(() -> invoke(callback, current));
        }
        return this;
    }

    public Future<R> onSuccess(Consumer<? super R> action) {
        Objects.requireNonNull(action, "action cannot be null");
        return respond(result -> result.onSuccess(action));
    }

    public Future<R> onFailure(Consumer<? super Exception> action) {
        Objects.requireNonNull(action, "action cannot be null");
        return respond(result -> result.onFailure(action));
    }

    public Future<R> foreach(Consumer<? super R> action) {
        return onSuccess(action);
    }

    // ==================== TRANSFORMATION ====================

    /**
     * Waits for this future, applies {@code next} to its result (success or failure) and
     * forwards the result of the future it returns.
     * <p>
     * If {@code next} throws or returns {@code null}, the returned future fails with that exception.
     *
     * @param next produces the follow-up future from this future's result
     * @param <R2> the new value type
     * @return a future bound to this future's queue
     */
    public <R2> Future<R2> transform(Function<? super Try<R>, ? extends Future<R2>> next) {
        Objects.requireNonNull(next, "next cannot be null");

        return create(queue, completion -> respond(result -> {
            Future<R2> following;
            try {
                following = Objects.requireNonNull(next.apply(result), "transform produced a null future");
            } catch (RuntimeException e) {
                completion.fail(e);
                return;
            }
            following.respond(completion::complete);
        }));
    }

    /**
     * Applies {@code mapper} to the success value. A failure passes through without invoking it.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Future<Integer> length = Future.success(queue, "hello").map(String::length);
     * // completes with Success(5)
     * }</pre>
     *
     * @param mapper the function to apply to the value
     * @param <R2>   the mapped type
     * @return a future of the mapped value
     */
    public <R2> Future<R2> map(Function<? super R, ? extends R2> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        return transform(result -> completed(queue, result.map(mapper)));
    }

    /**
     * Chains a dependent asynchronous step. On success the returned future mirrors the one
     * produced by {@code mapper}; on failure it fails with the same error and {@code mapper}
     * is not invoked.
     *
     * @param mapper produces the next future from the value
     * @param <R2>   the new value type
     * @return a future of the next step
     */
    public <R2> Future<R2> flatMap(Function<? super R, ? extends Future<R2>> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");

        return transform(result -> {
            if (result instanceof Success<R> success) {
                return mapper.apply(success.value());
            }
            return failed(queue, ((Failure<R>) result).error());
        });
    }

    /**
     * Keeps the value only if {@code predicate} holds for it, see {@link Try#filter}.
     */
    public Future<R> filter(Predicate<? super R> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return transform(result -> completed(queue, result.filter(predicate)));
    }

    /**
     * Recovers from a failure with another future. A success passes through unchanged.
     *
     * @param recovery produces a replacement future from the error
     * @return a future of the value or the recovered value
     */
    public Future<R> rescue(Function<? super Exception, ? extends Future<R>> recovery) {
        Objects.requireNonNull(recovery, "recovery cannot be null");

        return transform(result -> {
            if (result instanceof Failure<R> failure) {
                return recovery.apply(failure.error());
            }
            return completed(queue, result);
        });
    }

    /**
     * Converts a failure into a success value, see {@link Try#handle}.
     */
    public Future<R> handle(Function<? super Exception, ? extends R> recovery) {
        Objects.requireNonNull(recovery, "recovery cannot be null");
        return transform(result -> completed(queue, result.handle(recovery)));
    }

    // ==================== COMBINATION ====================

    /**
     * Races this future against {@code other}. The first one to complete, successfully or not,
     * decides the result; a success is tagged {@link Either.Left} for this future and
     * {@link Either.Right} for {@code other}.
     * <p>
     * The loser is not cancelled and keeps running.
     *
     * @param other the competing future
     * @param <R2>  the other value type
     * @return a future of the first result, bound to this future's queue
     */
    public <R2> Future<Either<R, R2>> or(Future<R2> other) {
        Objects.requireNonNull(other, "other cannot be null");

        return create(queue, completion -> {
            respond(result -> completion.complete(result.map(v -> Either.<R, R2>left(v))));
            other.respond(result -> completion.complete(result.map(v -> Either.<R, R2>right(v))));
        });
    }

    /**
     * Waits for both this future and {@code that} to succeed and yields both values.
     * <p>
     * If either fails, the joined future fails with that error right away. The other side is
     * not cancelled.
     *
     * <h4>Example</h4>
     * <pre>{@code
     * Future<Pair<Integer, String>> both = Future.success(queue, 1).join(Future.success(queue, "x"));
     * // completes with Success(Pair[left=1, right=x])
     * }</pre>
     *
     * @param that the other future
     * @param <R2> the other value type
     * @return a future of both values, bound to this future's queue
     */
    @SuppressWarnings("unchecked")
    public <R2> Future<Pair<R, R2>> join(Future<R2> that) {
        Objects.requireNonNull(that, "that cannot be null");

        return create(queue, completion -> {
            JoinAccumulator<Object> accumulator = new JoinAccumulator<>(2, values ->
                    completion.succeed(new Pair<>((R) values.get(0), (R2) values.get(1))));

            onSuccess(v -> accumulator.push(0, v)).onFailure(completion::fail);
            that.onSuccess(v -> accumulator.push(1, v)).onFailure(completion::fail);
        });
    }

    // ==================== TIMING AND REBINDING ====================

    /**
     * Bounds how long to wait for this future.
     * <p>
     * The returned future, bound to {@code forQueue}, completes with this future's result if it
     * arrives within {@code timeout}. Otherwise it fails with a {@link FutureTimeoutException}
     * carrying the missed deadline, and any later result of this future is dropped. If the result
     * arrives first, the timer is cancelled and never fires.
     * <p>
     * This future itself is not cancelled by a timeout.
     *
     * @param timeout  how long to wait, not negative
     * @param forQueue the queue the timer and the returned future run on
     * @return a future of the result or the timeout failure
     */
    public Future<R> timeout(Duration timeout, ExecutionQueue forQueue) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(forQueue, "forQueue cannot be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative (current: " + timeout + ")");
        }

        return create(forQueue, completion -> {
            // whichever side takes the handle first completes; the other finds it gone
            Guarded<Completion<R>> forward = new Guarded<>(completion);
            Instant deadline = Instant.now().plus(timeout);

            Cancellable timer = forQueue.schedule(() -> {
                Completion<R> detached = forward.getAndSet(null);
                if (detached != null) {
                    log.debug("{} missed its deadline {}", this, deadline);
                    detached.fail(new FutureTimeoutException(timeout, deadline));
                }
            }, timeout);

            respond(result -> {
                Completion<R> pending = forward.getAndSet(null);
                if (pending != null) {
                    timer.cancel();
                    pending.complete(result);
                }
            });
        });
    }

    /**
     * Same as {@link #timeout(Duration, ExecutionQueue)} on this future's own queue.
     */
    public Future<R> timeout(Duration timeout) {
        return timeout(timeout, queue);
    }

    /**
     * Mirrors this future on another queue, so that downstream continuations run there.
     *
     * @param target the queue to move to
     * @return a future with the same result, bound to {@code target}
     */
    public Future<R> observe(ExecutionQueue target) {
        Objects.requireNonNull(target, "target cannot be null");

        return create(target, completion ->
                respond(result -> target.submit(() -> completion.complete(result))));
    }

    // ==================== INSPECTION AND INTEROP ====================

    public ExecutionQueue queue() {
        return queue;
    }

    public boolean isCompleted() {
        return value.get() != null;
    }

    /**
     * Non-blocking peek at the result.
     *
     * @return the result if completed, empty otherwise
     */
    public Optional<Try<R>> value() {
        return Optional.ofNullable(value.get());
    }

    /**
     * Returns a {@link CompletableFuture} that completes with this future's value, or
     * exceptionally with its error.
     */
    public CompletableFuture<R> toCompletableFuture() {
        CompletableFuture<R> stage = new CompletableFuture<>();
        respond(result -> result
                .onSuccess(stage::complete)
                .onFailure(stage::completeExceptionally));
        return stage;
    }

    /**
     * Blocks the calling thread until this future completes or {@code timeout} elapses.
     * <p>
     * Use with caution: calling this from a task running on this future's own queue deadlocks a
     * serial queue until the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @return the result; a failure holding a {@link TimeoutException} if the wait elapsed, or
     * holding an {@link InterruptedException} if the thread was interrupted
     */
    public Try<R> block(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");

        CompletableFuture<Try<R>> done = new CompletableFuture<>();
        respond(done::complete);

        try {
            return done.get(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Try.failure(e);
        } catch (TimeoutException e) {
            return Try.failure(new TimeoutException("Future did not complete within " + timeout));
        } catch (ExecutionException e) {
            return Try.failure(asException(e));
        }
    }

    @Override
    public String toString() {
        Try<R> current = value.get();
        return current == null ? "Future[pending]" : "Future[" + current + "]";
    }

    /**
     * Unwraps CompletionException and ExecutionException to get the root cause.
     */
    private static Exception asException(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof Exception exception ? exception : new ExecutionException(cause);
    }
}
