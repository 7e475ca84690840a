package twig.core.suite;

/**
 * A stopper that requests a stop once {@link #requestStop()} has been called.
 *
 * This class is thread-safe.
 */
public final class SimpleStopper implements Stopper {
    private volatile boolean stopRequested = false;

    public void requestStop() {
        this.stopRequested = true;
    }

    @Override
    public boolean stopRequested() {
        return this.stopRequested;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + (this.stopRequested ? " { [stop requested] }" : " { [running] }");
    }
}
