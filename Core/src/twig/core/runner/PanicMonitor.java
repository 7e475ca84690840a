package twig.core.runner;

/**
 * Shared by the worker threads of a run so that they can report an unexpected error that crashed them.
 *
 * Only the first panic is recorded.
 *
 * This class is thread-safe.
 */
public final class PanicMonitor {
    private Throwable panic = null;

    /**
     * Records an unexpected error that the run cannot recover from.
     *
     * @param error The error.
     */
    public synchronized void panic(Throwable error) {
        if (error == null) {
            throw new NullPointerException("error must be non-null.");
        }
        if (this.panic == null) {
            this.panic = error;
        }
    }

    /**
     * Returns the cause of the first panic, or null if there was none.
     */
    public synchronized Throwable getPanicCause() {
        return this.panic;
    }

    public synchronized boolean isPanic() {
        return this.panic != null;
    }
}
