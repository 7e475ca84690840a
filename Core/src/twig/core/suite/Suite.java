package twig.core.suite;

import twig.core.exception.TestPendingException;
import twig.core.report.CatchReporter;
import twig.core.report.Report;
import twig.core.report.Reporter;
import twig.core.report.Rerunner;
import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named collection of tests, possibly containing nested suites.
 *
 * A runner drives a suite through {@link #execute}. Every test that is run produces exactly one
 * {@link Reporter#testStarting} report followed by exactly one of {@link Reporter#testSucceeded},
 * {@link Reporter#testFailed} or {@link Reporter#testPending}. A test that is skipped because it is ignored produces a
 * single {@link Reporter#testIgnored} report instead, and a test rejected by the tag filter produces nothing.
 *
 * Suites run their own tests sequentially. Distinct suite instances may be executed concurrently.
 */
public abstract class Suite {
    private static final Logger LOGGER = Logger.forClass(Suite.class);
    private final AtomicReference<Informer> activeInformer = new AtomicReference<>();

    /**
     * Returns the names of the tests in this suite in the order they run.
     */
    public abstract Set<String> testNames();

    /**
     * Runs the named test, reporting its start and its outcome.
     *
     * @param testName The name of the test.
     * @param reporter The reporter.
     * @param stopper The stopper.
     * @param configMap The configuration of the run.
     * @throws twig.core.exception.UnknownTestNameException if no test has that name.
     */
    public abstract void runTest(String testName, Reporter reporter, Stopper stopper, Map<String, Object> configMap);

    /**
     * Returns the tags of every test that has at least one tag.
     */
    public Map<String, Set<String>> tags() {
        return Collections.emptyMap();
    }

    /**
     * Returns the suites nested in this one. They are executed before this suite's own tests.
     */
    public List<Suite> nestedSuites() {
        return Collections.emptyList();
    }

    /**
     * Returns the name of this suite, used as the prefix of every test name in reports.
     */
    public String suiteName() {
        String simpleName = this.getClass().getSimpleName();
        return simpleName.isEmpty() ? this.getClass().getName() : simpleName;
    }

    /**
     * Returns the name under which the given test appears in reports.
     */
    public String testNameForReport(String testName) {
        return suiteName() + ": " + testName;
    }

    /**
     * Executes this suite with the default configuration: every test, no stopper, no include tags, and only ignored
     * tests excluded.
     *
     * @param reporter The reporter.
     */
    public final void execute(Reporter reporter) {
        execute(Optional.<String>empty(), reporter, Stopper.NEVER, Collections.<String>emptySet(), Collections.singleton(TagFilter.IGNORE_TAG), Collections.<String, Object>emptyMap());
    }

    /**
     * Executes this suite. No further tests may be registered once this method has been called.
     *
     * When no test name is given the nested suites are executed first, each wrapped in suite starting and completed (or
     * aborted) reports, followed by this suite's own tests. When a test name is given only that test is run, regardless
     * of its tags.
     *
     * @param testName The single test to run, if any.
     * @param reporter The reporter.
     * @param stopper Polled between tests; once it requests a stop no further tests are started.
     * @param includes If non-empty, only tests carrying one of these tags run.
     * @param excludes Tests carrying one of these tags do not run.
     * @param configMap The configuration of the run.
     */
    public void execute(Optional<String> testName, Reporter reporter, Stopper stopper, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        checkRunArguments(testName, reporter, stopper, includes, excludes, configMap);
        closeRegistration();

        Reporter wrappedReporter = CatchReporter.wrapIfNecessary(reporter);
        if (!testName.isPresent()) {
            runNestedSuites(wrappedReporter, stopper, includes, excludes, configMap);
        }
        runTests(testName, wrappedReporter, stopper, includes, excludes, configMap);

        if (stopper.stopRequested()) {
            LOGGER.log("Execution of " + suiteName() + " was stopped.");
            wrappedReporter.infoProvided(Report.of(suiteName(), "Execution of " + suiteName() + " was stopped."));
        }
    }

    /**
     * Runs the tests of this suite, excluding nested suites.
     *
     * @param testName The single test to run, if any.
     * @param reporter The reporter.
     * @param stopper The stopper.
     * @param includes If non-empty, only tests carrying one of these tags run.
     * @param excludes Tests carrying one of these tags do not run.
     * @param configMap The configuration of the run.
     */
    public void runTests(Optional<String> testName, Reporter reporter, Stopper stopper, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        checkRunArguments(testName, reporter, stopper, includes, excludes, configMap);

        if (testName.isPresent()) {
            runTest(testName.get(), reporter, stopper, configMap);
            return;
        }

        Map<String, Set<String>> tagsByTestName = tags();
        for (String name : testNames()) {
            if (stopper.stopRequested()) {
                break;
            }
            Set<String> testTags = tagsOf(tagsByTestName, name);
            if (!TagFilter.isIncluded(testTags, includes)) {
                continue;
            }
            if (TagFilter.isReportedIgnored(testTags, excludes)) {
                reportIgnored(name, reporter);
            } else if (TagFilter.shouldRun(testTags, includes, excludes)) {
                runTest(name, reporter, stopper, configMap);
            }
        }
    }

    /**
     * Returns the number of tests that {@link #execute} would run with the given tags, including the tests of the nested
     * suites. Ignored tests are not counted.
     *
     * @param includes If non-empty, only tests carrying one of these tags are counted.
     * @param excludes Tests carrying one of these tags are not counted.
     * @return the expected number of tests.
     */
    public int expectedTestCount(Set<String> includes, Set<String> excludes) {
        ObjectChecker.assertNonNull(includes, excludes);
        Map<String, Set<String>> tagsByTestName = tags();
        int count = 0;
        for (String name : testNames()) {
            if (TagFilter.shouldRun(tagsOf(tagsByTestName, name), includes, excludes)) {
                count++;
            }
        }
        for (Suite nested : nestedSuites()) {
            count += nested.expectedTestCount(includes, excludes);
        }
        return count;
    }

    /**
     * Returns a rerunner for this suite if the suite class can be instantiated reflectively.
     */
    public Optional<Rerunner> rerunnerForSuite() {
        return isRerunnable() ? Optional.of(Rerunner.forSuite(this.getClass().getName())) : Optional.<Rerunner>empty();
    }

    /**
     * Returns a rerunner for the given test of this suite if the suite class can be instantiated reflectively.
     */
    public Optional<Rerunner> rerunnerForTest(String testName) {
        return isRerunnable() ? Optional.of(Rerunner.forTest(this.getClass().getName(), testName)) : Optional.<Rerunner>empty();
    }

    /**
     * Called once when execution starts, after which no further tests may be registered.
     */
    protected void closeRegistration() {
    }

    /**
     * Sends an informational message about the test that is currently running to the reporter of the run.
     *
     * @param message The message.
     * @throws IllegalStateException if no test of this suite is currently running.
     */
    protected final void info(String message) {
        ObjectChecker.requireNonNull(message, "message");
        Informer informer = this.activeInformer.get();
        if (informer == null) {
            throw new IllegalStateException("info can only be called while a test is running.");
        }
        informer.info(message);
    }

    /**
     * Marks the currently running test as pending.
     *
     * @throws TestPendingException always.
     */
    protected final void pending() {
        throw new TestPendingException();
    }

    /**
     * Runs a test body under the single terminal event contract: one starting report, then the body inside the failure
     * boundary, then exactly one succeeded, failed or pending report.
     *
     * @param testName The name of the test.
     * @param body The test body.
     * @param reporter The reporter.
     */
    protected final void runReportedTest(String testName, InformingTestBody body, Reporter reporter) {
        String reportName = testNameForReport(testName);
        Optional<Rerunner> rerunner = rerunnerForTest(testName);
        reporter.testStarting(Report.of(reportName, "", Optional.<Throwable>empty(), rerunner));

        Informer informer = (message) -> reporter.infoProvided(Report.of(reportName, ObjectChecker.requireNonNull(message, "message")));
        Informer previous = this.activeInformer.getAndSet(informer);
        TestOutcome outcome;
        try {
            outcome = TestInvoker.invoke(body, informer);
        } finally {
            this.activeInformer.set(previous);
        }

        switch (outcome.getKind()) {
            case SUCCEEDED:
                reporter.testSucceeded(Report.of(reportName, "", Optional.<Throwable>empty(), rerunner));
                break;
            case PENDING:
                reporter.testPending(Report.of(reportName, "Test is pending."));
                break;
            case FAILED:
                LOGGER.log("Test failed: " + reportName);
                reporter.testFailed(Report.of(reportName, outcome.failureMessage(), outcome.getCause(), rerunner));
                break;
            default:
                throw new IllegalStateException("Unknown test outcome: " + outcome.getKind());
        }
    }

    /**
     * Reports the given test as ignored, without running it.
     */
    protected final void reportIgnored(String testName, Reporter reporter) {
        reporter.testIgnored(Report.of(testNameForReport(testName), "", Optional.<Throwable>empty(), rerunnerForTest(testName)));
    }

    protected static void checkRunArguments(Optional<String> testName, Reporter reporter, Stopper stopper, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        ObjectChecker.requireNonNull(testName, "testName");
        ObjectChecker.requireNonNull(reporter, "reporter");
        ObjectChecker.requireNonNull(stopper, "stopper");
        ObjectChecker.requireNonNull(includes, "includes");
        ObjectChecker.requireNonNull(excludes, "excludes");
        ObjectChecker.requireNonNull(configMap, "configMap");
    }

    private void runNestedSuites(Reporter reporter, Stopper stopper, Set<String> includes, Set<String> excludes, Map<String, Object> configMap) {
        for (Suite nested : nestedSuites()) {
            if (stopper.stopRequested()) {
                break;
            }
            String nestedName = nested.suiteName();
            Optional<Rerunner> rerunner = nested.rerunnerForSuite();
            reporter.suiteStarting(Report.of(nestedName, "", Optional.<Throwable>empty(), rerunner));
            try {
                nested.execute(Optional.<String>empty(), reporter, stopper, includes, excludes, configMap);
                reporter.suiteCompleted(Report.of(nestedName, "", Optional.<Throwable>empty(), rerunner));
            } catch (RuntimeException e) {
                LOGGER.log("Nested suite aborted: " + nestedName, e);
                String message = (e.getMessage() != null) ? e.getMessage() : e.toString();
                reporter.suiteAborted(Report.of(nestedName, message, Optional.<Throwable>of(e), rerunner));
            }
        }
    }

    private boolean isRerunnable() {
        Class<?> suiteClass = this.getClass();
        if (!Modifier.isPublic(suiteClass.getModifiers())) {
            return false;
        }
        try {
            return Modifier.isPublic(suiteClass.getConstructor().getModifiers());
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    private static Set<String> tagsOf(Map<String, Set<String>> tagsByTestName, String testName) {
        Set<String> tags = tagsByTestName.get(testName);
        return (tags == null) ? Collections.<String>emptySet() : tags;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + suiteName() + " }";
    }
}
