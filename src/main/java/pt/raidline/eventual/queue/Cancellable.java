package pt.raidline.eventual.queue;

/**
 * Handle to delayed work.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * @return {@code true} if the work had not started and now never will
     */
    boolean cancel();
}
