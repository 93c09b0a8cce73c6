package pt.raidline.eventual.queue;

/**
 * Settings for a {@link SerialQueue} (immutable record).
 *
 * @param label  the name given to the queue's worker thread, not blank
 * @param daemon whether the worker thread is a daemon thread
 */
public record SerialQueueConfig(String label, boolean daemon) {

    public SerialQueueConfig {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank (current: " + label + ")");
        }
    }

    /**
     * Defaults for the given label: a daemon worker thread.
     */
    public static SerialQueueConfig named(String label) {
        return new SerialQueueConfig(label, true);
    }
}
