package twig.core.runner;

import twig.core.report.Report;
import twig.core.report.Reporter;
import twig.core.report.Rerunner;
import twig.core.suite.Stopper;
import twig.core.suite.Suite;
import twig.core.util.CloseableBlockingQueue;
import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * A worker that executes every suite it takes off its incoming queue, until the queue is closed and drained or the
 * executor is shut down.
 *
 * Each suite is wrapped in a suite starting report and either a suite completed report or, if the suite throws, a suite
 * aborted report. Once the stopper requests a stop the remaining suites are drained without being executed.
 */
public final class SuiteExecutor implements Runnable {
    private static final Logger LOGGER = Logger.forClass(SuiteExecutor.class);
    private final CloseableBlockingQueue<Suite> incomingSuites;
    private final Reporter reporter;
    private final Stopper stopper;
    private final PanicMonitor panicMonitor;
    private final Optional<String> testName;
    private final Set<String> includes;
    private final Set<String> excludes;
    private final Map<String, Object> configMap;
    private volatile boolean isAlive = true;

    private SuiteExecutor(CloseableBlockingQueue<Suite> incomingSuites, Reporter reporter, Stopper stopper, PanicMonitor panicMonitor, Optional<String> testName, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        ObjectChecker.assertNonNull(incomingSuites, reporter, stopper, panicMonitor, testName, includes, excludes, configMap);
        this.incomingSuites = incomingSuites;
        this.reporter = reporter;
        this.stopper = stopper;
        this.panicMonitor = panicMonitor;
        this.testName = testName;
        this.includes = includes;
        this.excludes = excludes;
        this.configMap = configMap;
    }

    /**
     * Constructs a new executor that runs the suites arriving on the given queue with the given run settings.
     *
     * @param incomingSuites The queue suites arrive on.
     * @param reporter The reporter of the run, which must be safe to use from several threads.
     * @param stopper The stopper of the run.
     * @param panicMonitor The monitor to report unexpected errors to.
     * @param testName The single test to run in each suite, if any.
     * @param includes The include tags.
     * @param excludes The exclude tags.
     * @param configMap The configuration map.
     * @return the new executor.
     */
    public static SuiteExecutor withQueue(CloseableBlockingQueue<Suite> incomingSuites, Reporter reporter, Stopper stopper, PanicMonitor panicMonitor, Optional<String> testName, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        return new SuiteExecutor(incomingSuites, reporter, stopper, panicMonitor, testName, includes, excludes, configMap);
    }

    @Override
    public void run() {
        try {
            LOGGER.log(Thread.currentThread().getName() + " thread started.");

            while (this.isAlive && !this.incomingSuites.isDrained()) {
                Suite suite = this.incomingSuites.poll(1, TimeUnit.SECONDS);
                if ((suite != null) && !this.stopper.stopRequested()) {
                    executeSuite(suite);
                }
            }

        } catch (Throwable t) {
            this.panicMonitor.panic(t);
        } finally {
            this.isAlive = false;
            LOGGER.log("Exiting.");
        }
    }

    /**
     * Shuts down this executor once the suite it is currently executing, if any, is finished.
     */
    public void shutdown() {
        this.isAlive = false;
    }

    private void executeSuite(Suite suite) {
        String suiteName = suite.suiteName();
        Optional<Rerunner> rerunner = suite.rerunnerForSuite();
        LOGGER.log("Executing suite: " + suiteName);

        this.reporter.suiteStarting(Report.of(suiteName, "", Optional.<Throwable>empty(), rerunner));
        try {
            suite.execute(this.testName, this.reporter, this.stopper, this.includes, this.excludes, this.configMap);
            this.reporter.suiteCompleted(Report.of(suiteName, "", Optional.<Throwable>empty(), rerunner));
        } catch (RuntimeException e) {
            LOGGER.log("Suite aborted: " + suiteName, e);
            String message = (e.getMessage() != null) ? e.getMessage() : e.toString();
            this.reporter.suiteAborted(Report.of(suiteName, message, Optional.<Throwable>of(e), rerunner));
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + (this.isAlive ? " { [running] }" : " { [shutdown] }");
    }
}
