package twig.core.helper;

import twig.core.report.Report;
import twig.core.report.Reporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reporter that records every event it receives as "eventName:reportName" (or just "eventName" for events without a
 * report) together with the reports themselves.
 */
public final class RecordingReporter implements Reporter {
    private final List<String> events = new ArrayList<>();
    private final List<String> reportEvents = new ArrayList<>();
    private final List<Report> reports = new ArrayList<>();
    private int expectedTestCount = -1;
    private boolean disposed = false;

    @Override
    public synchronized void runStarting(int expectedTestCount) {
        this.expectedTestCount = expectedTestCount;
        this.events.add("runStarting");
    }

    @Override
    public synchronized void runCompleted() {
        this.events.add("runCompleted");
    }

    @Override
    public synchronized void runStopped() {
        this.events.add("runStopped");
    }

    @Override
    public synchronized void runAborted(Report report) {
        record("runAborted", report);
    }

    @Override
    public synchronized void suiteStarting(Report report) {
        record("suiteStarting", report);
    }

    @Override
    public synchronized void suiteCompleted(Report report) {
        record("suiteCompleted", report);
    }

    @Override
    public synchronized void suiteAborted(Report report) {
        record("suiteAborted", report);
    }

    @Override
    public synchronized void testStarting(Report report) {
        record("testStarting", report);
    }

    @Override
    public synchronized void testSucceeded(Report report) {
        record("testSucceeded", report);
    }

    @Override
    public synchronized void testFailed(Report report) {
        record("testFailed", report);
    }

    @Override
    public synchronized void testIgnored(Report report) {
        record("testIgnored", report);
    }

    @Override
    public synchronized void testPending(Report report) {
        record("testPending", report);
    }

    @Override
    public synchronized void infoProvided(Report report) {
        record("infoProvided", report);
    }

    @Override
    public synchronized void dispose() {
        this.disposed = true;
    }

    public synchronized List<String> getEvents() {
        return Collections.unmodifiableList(new ArrayList<>(this.events));
    }

    /**
     * Returns the events whose name is the given event name, as their report names.
     */
    public synchronized List<String> getReportNames(String eventName) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < this.events.size(); i++) {
            if (this.events.get(i).startsWith(eventName + ":")) {
                names.add(this.events.get(i).substring(eventName.length() + 1));
            }
        }
        return names;
    }

    /**
     * Returns the first report received with the given event and report name.
     */
    public synchronized Report getReport(String eventName, String reportName) {
        for (int i = 0; i < this.reportEvents.size(); i++) {
            if (this.reportEvents.get(i).equals(eventName) && this.reports.get(i).getName().equals(reportName)) {
                return this.reports.get(i);
            }
        }
        throw new AssertionError("No " + eventName + " report named: " + reportName);
    }

    public synchronized int getExpectedTestCount() {
        return this.expectedTestCount;
    }

    public synchronized boolean isDisposed() {
        return this.disposed;
    }

    private void record(String eventName, Report report) {
        this.events.add(eventName + ":" + report.getName());
        this.reportEvents.add(eventName);
        this.reports.add(report);
    }
}
