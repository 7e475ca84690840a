package twig.core.report;

import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.io.PrintStream;
import java.util.function.Consumer;

/**
 * A reporter that forwards every event to an underlying reporter and catches any exception that reporter throws, so
 * that a faulty reporter can never abort a run. The exception is printed to an error stream instead.
 */
public final class CatchReporter implements Reporter {
    private static final Logger LOGGER = Logger.forClass(CatchReporter.class);
    private final Reporter reporter;
    private final PrintStream errorStream;

    private CatchReporter(Reporter reporter, PrintStream errorStream) {
        ObjectChecker.assertNonNull(reporter, errorStream);
        this.reporter = reporter;
        this.errorStream = errorStream;
    }

    /**
     * Wraps the given reporter so that its exceptions are printed to {@link System#err}. Reporters that already catch
     * their own exceptions are returned unchanged.
     *
     * @param reporter The reporter to wrap.
     * @return the wrapped reporter.
     */
    public static Reporter wrapIfNecessary(Reporter reporter) {
        ObjectChecker.assertNonNull(reporter);
        if ((reporter instanceof CatchReporter) || (reporter instanceof DispatchReporter)) {
            return reporter;
        }
        return new CatchReporter(reporter, System.err);
    }

    /**
     * Wraps the given reporter so that its exceptions are printed to the given stream.
     *
     * @param reporter The reporter to wrap.
     * @param errorStream The stream to print reporter failures to.
     * @return the wrapped reporter.
     */
    public static CatchReporter wrapping(Reporter reporter, PrintStream errorStream) {
        return new CatchReporter(reporter, errorStream);
    }

    @Override
    public void runStarting(int expectedTestCount) {
        dispatch("runStarting", (r) -> r.runStarting(expectedTestCount));
    }

    @Override
    public void runCompleted() {
        dispatch("runCompleted", Reporter::runCompleted);
    }

    @Override
    public void runStopped() {
        dispatch("runStopped", Reporter::runStopped);
    }

    @Override
    public void runAborted(Report report) {
        dispatch("runAborted", (r) -> r.runAborted(report));
    }

    @Override
    public void suiteStarting(Report report) {
        dispatch("suiteStarting", (r) -> r.suiteStarting(report));
    }

    @Override
    public void suiteCompleted(Report report) {
        dispatch("suiteCompleted", (r) -> r.suiteCompleted(report));
    }

    @Override
    public void suiteAborted(Report report) {
        dispatch("suiteAborted", (r) -> r.suiteAborted(report));
    }

    @Override
    public void testStarting(Report report) {
        dispatch("testStarting", (r) -> r.testStarting(report));
    }

    @Override
    public void testSucceeded(Report report) {
        dispatch("testSucceeded", (r) -> r.testSucceeded(report));
    }

    @Override
    public void testFailed(Report report) {
        dispatch("testFailed", (r) -> r.testFailed(report));
    }

    @Override
    public void testIgnored(Report report) {
        dispatch("testIgnored", (r) -> r.testIgnored(report));
    }

    @Override
    public void testPending(Report report) {
        dispatch("testPending", (r) -> r.testPending(report));
    }

    @Override
    public void infoProvided(Report report) {
        dispatch("infoProvided", (r) -> r.infoProvided(report));
    }

    @Override
    public void dispose() {
        dispatch("dispose", Reporter::dispose);
    }

    private void dispatch(String methodName, Consumer<Reporter> event) {
        try {
            event.accept(this.reporter);
        } catch (RuntimeException e) {
            LOGGER.log("Reporter " + this.reporter + " threw while handling " + methodName + ".");
            this.errorStream.println("Reporter completed abruptly with an exception after receiving event: " + methodName + ".");
            e.printStackTrace(this.errorStream);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { wrapping: " + this.reporter + " }";
    }
}
