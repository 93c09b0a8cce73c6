package pt.raidline.eventual.async;

/**
 * The computation behind a {@link Future}.
 * <p>
 * It runs once on the future's queue and must eventually call the {@link Completion} it
 * receives, either before returning or later from any thread. If it throws before
 * completing, the future fails with the thrown exception.
 *
 * @param <R> the type of the success value
 */
@FunctionalInterface
public interface Producer<R> {

    void produce(Completion<R> completion) throws Exception;
}
