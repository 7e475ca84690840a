package twig.core.suite;

/**
 * Polled between tests to find out whether a run should stop early. A stop never interrupts a test that is already
 * running.
 */
@FunctionalInterface
public interface Stopper {

    /**
     * A stopper that never requests a stop.
     */
    public static final Stopper NEVER = () -> false;

    /**
     * Returns true iff a stop has been requested.
     *
     * @return whether a stop has been requested.
     */
    public boolean stopRequested();
}
