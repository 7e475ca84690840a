package twig.client.output;

import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import twig.core.report.Report;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public class ConsoleReporterTest {
    private ByteArrayOutputStream bytes;
    private ConsoleReporter reporter;

    @Before
    public void setup() throws UnsupportedEncodingException {
        this.bytes = new ByteArrayOutputStream();
        this.reporter = ConsoleReporter.printingTo(new PrintStream(this.bytes, true, "UTF-8"));
    }

    @Test
    public void testCountsAndSummary() {
        this.reporter.runStarting(4);
        this.reporter.suiteStarting(Report.of("StackSuite", ""));
        this.reporter.testStarting(Report.of("StackSuite: push", ""));
        this.reporter.testSucceeded(Report.of("StackSuite: push", ""));
        this.reporter.testStarting(Report.of("StackSuite: pop", ""));
        this.reporter.testFailed(Report.of("StackSuite: pop", "expected 1 but was 2", Optional.<Throwable>of(new AssertionError("expected 1 but was 2")), Optional.empty()));
        this.reporter.testIgnored(Report.of("StackSuite: peek", ""));
        this.reporter.testStarting(Report.of("StackSuite: clear", ""));
        this.reporter.testPending(Report.of("StackSuite: clear", "Test is pending."));
        this.reporter.suiteCompleted(Report.of("StackSuite", ""));
        this.reporter.runCompleted();
        this.reporter.dispose();

        Assert.assertEquals(1, this.reporter.getNumSucceeded());
        Assert.assertEquals(1, this.reporter.getNumFailed());
        Assert.assertEquals(1, this.reporter.getNumIgnored());
        Assert.assertEquals(1, this.reporter.getNumPending());
        Assert.assertFalse(this.reporter.isSuccess());

        String output = output();
        Assert.assertThat(output, Matchers.containsString("RUN STARTING: expecting 4 tests."));
        Assert.assertThat(output, Matchers.containsString("\tTest: StackSuite: push"));
        Assert.assertThat(output, Matchers.containsString("\tSUCCESS, duration: "));
        Assert.assertThat(output, Matchers.containsString("\tFAILED, duration: "));
        Assert.assertThat(output, Matchers.containsString("expected 1 but was 2"));
        Assert.assertThat(output, Matchers.containsString("\tIGNORED"));
        Assert.assertThat(output, Matchers.containsString("\tPENDING, duration: "));
        Assert.assertThat(output, Matchers.containsString("RUN COMPLETED:"));
        Assert.assertThat(output, Matchers.containsString("Suites: completed: 1, aborted: 0"));
        Assert.assertThat(output, Matchers.containsString("Tests: expected: 4, successes: 1, failures: 1, ignored: 1, pending: 1"));
    }

    @Test
    public void testPendingAndIgnoredTestsDoNotFailTheRun() {
        this.reporter.runStarting(2);
        this.reporter.testIgnored(Report.of("S: a", ""));
        this.reporter.testPending(Report.of("S: b", ""));
        this.reporter.runCompleted();

        Assert.assertTrue(this.reporter.isSuccess());
        // No testStarting was seen for the pending test.
        Assert.assertThat(output(), Matchers.containsString("PENDING, duration: unknown"));
    }

    @Test
    public void testAbortedSuiteFailsTheRun() {
        this.reporter.suiteStarting(Report.of("S", ""));
        this.reporter.suiteAborted(Report.of("S", "boom", Optional.<Throwable>of(new IllegalStateException("boom")), Optional.empty()));
        this.reporter.runCompleted();

        Assert.assertFalse(this.reporter.isSuccess());
        Assert.assertThat(output(), Matchers.containsString("SUITE ABORTED: S"));
        Assert.assertThat(output(), Matchers.containsString("java.lang.IllegalStateException: boom"));
    }

    @Test
    public void testAbortedRunFailsTheRun() {
        this.reporter.runAborted(Report.of("Run", "Failed to load suites"));

        Assert.assertFalse(this.reporter.isSuccess());
        Assert.assertThat(output(), Matchers.containsString("RUN ABORTED: Failed to load suites"));
    }

    @Test
    public void testInfo() {
        this.reporter.infoProvided(Report.of("S: a", "pushed 3 elements"));
        Assert.assertThat(output(), Matchers.containsString("\t+ S: a: pushed 3 elements"));
    }

    private String output() {
        return new String(this.bytes.toByteArray(), StandardCharsets.UTF_8);
    }
}
