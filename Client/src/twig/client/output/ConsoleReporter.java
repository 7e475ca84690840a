package twig.client.output;

import twig.core.report.Report;
import twig.core.report.Reporter;
import twig.core.util.Logger;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes the events of a run to the console and prints a summary when the run ends.
 *
 * This reporter expects to receive events from one thread at a time, which is what a
 * {@link twig.core.report.DispatchReporter} guarantees.
 */
public final class ConsoleReporter implements Reporter {
    private static final Logger LOGGER = Logger.forClass(ConsoleReporter.class);
    private static final String SEPARATOR = "===============================================================";
    private final PrintStream out;
    private final Map<String, Instant> startTimes = new HashMap<>();
    private Instant runStart = null;
    private int expectedTestCount = 0;
    private int numSucceeded = 0;
    private int numFailed = 0;
    private int numIgnored = 0;
    private int numPending = 0;
    private int numSuitesCompleted = 0;
    private int numSuitesAborted = 0;
    private boolean runAborted = false;

    private ConsoleReporter(PrintStream out) {
        if (out == null) {
            throw new NullPointerException("out must be non-null.");
        }
        this.out = out;
    }

    public static ConsoleReporter printingTo(PrintStream out) {
        return new ConsoleReporter(out);
    }

    @Override
    public void runStarting(int expectedTestCount) {
        this.runStart = Instant.now();
        this.expectedTestCount = expectedTestCount;
        this.out.println("\n" + SEPARATOR);
        this.out.println("RUN STARTING: expecting " + expectedTestCount + " tests.");
    }

    @Override
    public void runCompleted() {
        printSummary("RUN COMPLETED");
    }

    @Override
    public void runStopped() {
        printSummary("RUN STOPPED");
    }

    @Override
    public void runAborted(Report report) {
        this.runAborted = true;
        this.out.println("\nRUN ABORTED: " + report.getMessage());
        printCause(report);
        printSummary("RUN ABORTED");
    }

    @Override
    public void suiteStarting(Report report) {
        this.startTimes.put(report.getName(), report.getTimestamp());
        this.out.println("\nSUITE STARTING: " + report.getName());
    }

    @Override
    public void suiteCompleted(Report report) {
        this.numSuitesCompleted++;
        this.out.println("\nSUITE COMPLETED: " + report.getName() + ", duration: " + durationOf(report));
    }

    @Override
    public void suiteAborted(Report report) {
        this.numSuitesAborted++;
        this.out.println("\nSUITE ABORTED: " + report.getName() + ", duration: " + durationOf(report));
        this.out.println("\t" + report.getMessage());
        printCause(report);
    }

    @Override
    public void testStarting(Report report) {
        this.startTimes.put(report.getName(), report.getTimestamp());
        LOGGER.log("Test starting: " + report.getName());
    }

    @Override
    public void testSucceeded(Report report) {
        this.numSucceeded++;
        this.out.println("\nTEST RESULT:");
        this.out.println("\tTest: " + report.getName());
        this.out.println("\tSUCCESS, duration: " + durationOf(report));
    }

    @Override
    public void testFailed(Report report) {
        this.numFailed++;
        this.out.println("\nTEST RESULT:");
        this.out.println("\tTest: " + report.getName());
        this.out.println("\tFAILED, duration: " + durationOf(report));
        this.out.println("\t" + report.getMessage());
        printCause(report);
    }

    @Override
    public void testIgnored(Report report) {
        this.numIgnored++;
        this.out.println("\nTEST RESULT:");
        this.out.println("\tTest: " + report.getName());
        this.out.println("\tIGNORED");
    }

    @Override
    public void testPending(Report report) {
        this.numPending++;
        this.out.println("\nTEST RESULT:");
        this.out.println("\tTest: " + report.getName());
        this.out.println("\tPENDING, duration: " + durationOf(report));
    }

    @Override
    public void infoProvided(Report report) {
        this.out.println("\t+ " + report.getName() + ": " + report.getMessage());
    }

    @Override
    public void dispose() {
        this.out.flush();
        LOGGER.log("Disposed.");
    }

    /**
     * Returns true iff no test failed, no suite aborted and the run itself did not abort.
     */
    public boolean isSuccess() {
        return (this.numFailed == 0) && (this.numSuitesAborted == 0) && !this.runAborted;
    }

    public int getNumSucceeded() {
        return this.numSucceeded;
    }

    public int getNumFailed() {
        return this.numFailed;
    }

    public int getNumIgnored() {
        return this.numIgnored;
    }

    public int getNumPending() {
        return this.numPending;
    }

    private void printSummary(String heading) {
        this.out.println("\n" + heading + ":");
        this.out.println("\tSuites: completed: " + this.numSuitesCompleted + ", aborted: " + this.numSuitesAborted);
        this.out.println("\tTests: expected: " + this.expectedTestCount
                + ", successes: " + this.numSucceeded
                + ", failures: " + this.numFailed
                + ", ignored: " + this.numIgnored
                + ", pending: " + this.numPending);
        if (this.runStart != null) {
            this.out.println("\tDuration: " + nanosToSecondsString(Duration.between(this.runStart, Instant.now()).toNanos()));
        }
        this.out.println(SEPARATOR);
    }

    private void printCause(Report report) {
        if (report.getCause().isPresent()) {
            this.out.println("\t---- cause ----");
            report.getCause().get().printStackTrace(this.out);
            this.out.println("\t---------------");
        }
    }

    private String durationOf(Report report) {
        Instant start = this.startTimes.remove(report.getName());
        if (start == null) {
            return "unknown";
        }
        return nanosToSecondsString(Duration.between(start, report.getTimestamp()).toNanos());
    }

    private static String nanosToSecondsString(long nanos) {
        return BigDecimal.valueOf(nanos).setScale(4, RoundingMode.HALF_DOWN)
                .divide(BigDecimal.valueOf(1_000_000_000L), RoundingMode.HALF_DOWN).setScale(4, RoundingMode.HALF_DOWN)
                .toPlainString();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { successes: " + this.numSucceeded + ", failures: " + this.numFailed + " }";
    }
}
