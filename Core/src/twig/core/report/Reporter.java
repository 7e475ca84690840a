package twig.core.report;

/**
 * A sink for the lifecycle events of a run.
 *
 * A suite calls its reporter sequentially, never concurrently, so a reporter handed to exactly one suite needs no
 * synchronization. A reporter shared by suites that run in parallel must either be thread-safe or be wrapped in a
 * {@link DispatchReporter}.
 *
 * For every test that is run a reporter receives exactly one {@link Reporter#testStarting(Report)} followed by exactly
 * one of {@link Reporter#testSucceeded(Report)}, {@link Reporter#testFailed(Report)} or
 * {@link Reporter#testPending(Report)}. A test that is ignored receives only {@link Reporter#testIgnored(Report)}.
 */
public interface Reporter {

    /**
     * Invoked before any suite of a run is executed.
     *
     * @param expectedTestCount The number of tests expected to run.
     */
    public void runStarting(int expectedTestCount);

    public void runCompleted();

    /**
     * Invoked instead of {@link Reporter#runCompleted()} when a run ended early because a stop was requested.
     */
    public void runStopped();

    public void runAborted(Report report);

    public void suiteStarting(Report report);

    public void suiteCompleted(Report report);

    /**
     * Invoked when a suite terminated abruptly by throwing an exception that no test boundary caught.
     *
     * @param report The report, whose cause is the exception that aborted the suite.
     */
    public void suiteAborted(Report report);

    public void testStarting(Report report);

    public void testSucceeded(Report report);

    /**
     * Invoked when a test completed abruptly with an exception or assertion error.
     *
     * @param report The report, whose cause is the failure.
     */
    public void testFailed(Report report);

    public void testIgnored(Report report);

    /**
     * Invoked when a test declared itself pending.
     *
     * @param report The report.
     */
    public void testPending(Report report);

    public void infoProvided(Report report);

    /**
     * Releases any resources held by this reporter. No further events are delivered after this call.
     */
    public void dispose();
}
