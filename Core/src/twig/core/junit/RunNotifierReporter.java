package twig.core.junit;

import org.junit.AssumptionViolatedException;
import org.junit.runner.Description;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunNotifier;
import twig.core.report.Report;
import twig.core.report.Reporter;
import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.util.Map;

/**
 * Translates Twig reports into calls on a JUnit {@link RunNotifier}.
 *
 * A failed test is reported as a failure followed by a finish, a pending test as an assumption failure followed by a
 * finish. An aborted suite or run is reported as a failure of the top level description.
 */
final class RunNotifierReporter implements Reporter {
    private static final Logger LOGGER = Logger.forClass(RunNotifierReporter.class);
    private final RunNotifier notifier;
    private final Description suiteDescription;
    private final Map<String, Description> descriptionsByReportName;

    RunNotifierReporter(RunNotifier notifier, Description suiteDescription, Map<String, Description> descriptionsByReportName) {
        ObjectChecker.assertNonNull(notifier, suiteDescription, descriptionsByReportName);
        this.notifier = notifier;
        this.suiteDescription = suiteDescription;
        this.descriptionsByReportName = descriptionsByReportName;
    }

    @Override
    public void runStarting(int expectedTestCount) {
    }

    @Override
    public void runCompleted() {
    }

    @Override
    public void runStopped() {
    }

    @Override
    public void runAborted(Report report) {
        this.notifier.fireTestFailure(new Failure(this.suiteDescription, causeOf(report)));
    }

    @Override
    public void suiteStarting(Report report) {
    }

    @Override
    public void suiteCompleted(Report report) {
    }

    @Override
    public void suiteAborted(Report report) {
        this.notifier.fireTestFailure(new Failure(this.suiteDescription, causeOf(report)));
    }

    @Override
    public void testStarting(Report report) {
        this.notifier.fireTestStarted(descriptionOf(report));
    }

    @Override
    public void testSucceeded(Report report) {
        this.notifier.fireTestFinished(descriptionOf(report));
    }

    @Override
    public void testFailed(Report report) {
        Description description = descriptionOf(report);
        this.notifier.fireTestFailure(new Failure(description, causeOf(report)));
        this.notifier.fireTestFinished(description);
    }

    @Override
    public void testIgnored(Report report) {
        this.notifier.fireTestIgnored(descriptionOf(report));
    }

    @Override
    public void testPending(Report report) {
        Description description = descriptionOf(report);
        this.notifier.fireTestAssumptionFailed(new Failure(description, new AssumptionViolatedException(report.getMessage())));
        this.notifier.fireTestFinished(description);
    }

    @Override
    public void infoProvided(Report report) {
        LOGGER.log(report.getName() + ": " + report.getMessage());
    }

    @Override
    public void dispose() {
    }

    private Description descriptionOf(Report report) {
        Description description = this.descriptionsByReportName.get(report.getName());
        if (description == null) {
            description = Description.createTestDescription(this.suiteDescription.getClassName(), report.getName());
        }
        return description;
    }

    private static Throwable causeOf(Report report) {
        return report.getCause().isPresent() ? report.getCause().get() : new AssertionError(report.getMessage());
    }
}
