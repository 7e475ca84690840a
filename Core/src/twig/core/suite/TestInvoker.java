package twig.core.suite;

import twig.core.exception.TestPendingException;

/**
 * The failure boundary around a test body.
 *
 * A body that throws {@link TestPendingException} is pending. A body that throws anything else, checked or unchecked,
 * {@link Exception} or {@link Error}, has failed. Nothing a test body throws escapes this boundary, so every test that
 * starts ends with exactly one terminal report and the tests after it still run.
 */
public final class TestInvoker {

    private TestInvoker() {}

    public static TestOutcome invoke(InformingTestBody body, Informer informer) {
        try {
            body.run(informer);
            return TestOutcome.succeeded();
        } catch (TestPendingException e) {
            return TestOutcome.pending();
        } catch (Throwable t) {
            return TestOutcome.failed(t);
        }
    }
}
