package twig.core.helper;

import twig.core.report.Report;
import twig.core.report.Reporter;

/**
 * A reporter that forwards every event to a delegate. Tests override single events to inject faults.
 */
public abstract class ForwardingReporter implements Reporter {
    private final Reporter delegate;

    protected ForwardingReporter(Reporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void runStarting(int expectedTestCount) {
        this.delegate.runStarting(expectedTestCount);
    }

    @Override
    public void runCompleted() {
        this.delegate.runCompleted();
    }

    @Override
    public void runStopped() {
        this.delegate.runStopped();
    }

    @Override
    public void runAborted(Report report) {
        this.delegate.runAborted(report);
    }

    @Override
    public void suiteStarting(Report report) {
        this.delegate.suiteStarting(report);
    }

    @Override
    public void suiteCompleted(Report report) {
        this.delegate.suiteCompleted(report);
    }

    @Override
    public void suiteAborted(Report report) {
        this.delegate.suiteAborted(report);
    }

    @Override
    public void testStarting(Report report) {
        this.delegate.testStarting(report);
    }

    @Override
    public void testSucceeded(Report report) {
        this.delegate.testSucceeded(report);
    }

    @Override
    public void testFailed(Report report) {
        this.delegate.testFailed(report);
    }

    @Override
    public void testIgnored(Report report) {
        this.delegate.testIgnored(report);
    }

    @Override
    public void testPending(Report report) {
        this.delegate.testPending(report);
    }

    @Override
    public void infoProvided(Report report) {
        this.delegate.infoProvided(report);
    }

    @Override
    public void dispose() {
        this.delegate.dispose();
    }
}
