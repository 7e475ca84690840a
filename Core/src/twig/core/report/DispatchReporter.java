package twig.core.report;

import twig.core.util.CloseableBlockingQueue;
import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A reporter that forwards every event it receives to a fixed list of reporters.
 *
 * Events are placed on a queue and delivered by a single dispatcher thread, so the underlying reporters see events one
 * at a time, in the order they were received, even when several suites report concurrently. Each underlying reporter is
 * wrapped in a {@link CatchReporter} so that one faulty reporter cannot stop the others from receiving events.
 *
 * {@link #dispose()} delivers every event still queued, disposes each underlying reporter and then stops the dispatcher.
 *
 * This class is thread-safe.
 */
public final class DispatchReporter implements Reporter {
    private static final Logger LOGGER = Logger.forClass(DispatchReporter.class);
    private static final int QUEUE_CAPACITY = 1_000;
    private final List<Reporter> reporters;
    private final CloseableBlockingQueue<Event> events;
    private final Thread dispatcherThread;
    private final AtomicBoolean isDisposed = new AtomicBoolean(false);

    private DispatchReporter(List<Reporter> reporters) {
        List<Reporter> wrapped = new ArrayList<>();
        for (Reporter reporter : reporters) {
            ObjectChecker.assertNonNull(reporter);
            wrapped.add(CatchReporter.wrapIfNecessary(reporter));
        }
        this.reporters = Collections.unmodifiableList(wrapped);
        this.events = CloseableBlockingQueue.withCapacity(QUEUE_CAPACITY);
        this.dispatcherThread = new Thread(new Dispatcher(), "DispatchReporter");
        this.dispatcherThread.setDaemon(true);
    }

    /**
     * Constructs a new dispatch reporter that forwards to the given reporters and starts its dispatcher thread.
     *
     * @param reporters The reporters to forward events to.
     * @return the new reporter.
     */
    public static DispatchReporter dispatchingTo(List<Reporter> reporters) {
        ObjectChecker.assertNonNull(reporters);
        DispatchReporter dispatchReporter = new DispatchReporter(reporters);
        dispatchReporter.dispatcherThread.start();
        return dispatchReporter;
    }

    /**
     * Constructs a new dispatch reporter that forwards to the given reporters and starts its dispatcher thread.
     *
     * @param reporters The reporters to forward events to.
     * @return the new reporter.
     */
    public static DispatchReporter dispatchingTo(Reporter... reporters) {
        ObjectChecker.assertNonNull(reporters);
        List<Reporter> list = new ArrayList<>();
        Collections.addAll(list, reporters);
        return dispatchingTo(list);
    }

    @Override
    public void runStarting(int expectedTestCount) {
        enqueue((r) -> r.runStarting(expectedTestCount));
    }

    @Override
    public void runCompleted() {
        enqueue(Reporter::runCompleted);
    }

    @Override
    public void runStopped() {
        enqueue(Reporter::runStopped);
    }

    @Override
    public void runAborted(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.runAborted(report));
    }

    @Override
    public void suiteStarting(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.suiteStarting(report));
    }

    @Override
    public void suiteCompleted(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.suiteCompleted(report));
    }

    @Override
    public void suiteAborted(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.suiteAborted(report));
    }

    @Override
    public void testStarting(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.testStarting(report));
    }

    @Override
    public void testSucceeded(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.testSucceeded(report));
    }

    @Override
    public void testFailed(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.testFailed(report));
    }

    @Override
    public void testIgnored(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.testIgnored(report));
    }

    @Override
    public void testPending(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.testPending(report));
    }

    @Override
    public void infoProvided(Report report) {
        ObjectChecker.assertNonNull(report);
        enqueue((r) -> r.infoProvided(report));
    }

    /**
     * Delivers all queued events, disposes of the underlying reporters and waits for the dispatcher thread to exit.
     * Calling this method more than once has no further effect.
     */
    @Override
    public void dispose() {
        if (!this.isDisposed.compareAndSet(false, true)) {
            return;
        }
        enqueue(Reporter::dispose);
        this.events.close();
        try {
            this.dispatcherThread.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the dispatcher to exit.", e);
        }
        LOGGER.log("Dispatcher shut down.");
    }

    private void enqueue(Event event) {
        try {
            if (!this.events.add(event)) {
                throw new IllegalStateException("Cannot report to a disposed " + this.getClass().getSimpleName() + ".");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while dispatching a report.", e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { reporters: " + this.reporters.size() + (this.isDisposed.get() ? ", [disposed] }" : ", [running] }");
    }

    @FunctionalInterface
    private interface Event {
        public void deliverTo(Reporter reporter);
    }

    private final class Dispatcher implements Runnable {

        @Override
        public void run() {
            LOGGER.log(Thread.currentThread().getName() + " thread started.");
            try {
                while (!events.isDrained()) {
                    Event event = events.poll(1, TimeUnit.SECONDS);
                    if (event != null) {
                        for (Reporter reporter : reporters) {
                            event.deliverTo(reporter);
                        }
                    }
                }
            } catch (InterruptedException e) {
                LOGGER.log("Dispatcher interrupted, remaining events are dropped.", e);
                Thread.currentThread().interrupt();
            } finally {
                LOGGER.log("Exiting.");
            }
        }
    }
}
