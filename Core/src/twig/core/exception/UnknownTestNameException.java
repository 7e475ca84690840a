package twig.core.exception;

/**
 * Thrown when asked to run a test under a name that was never registered.
 */
public final class UnknownTestNameException extends IllegalArgumentException {
    private final String testName;

    public UnknownTestNameException(String testName) {
        super("No test registered with name: " + testName);
        this.testName = testName;
    }

    public String getTestName() {
        return this.testName;
    }
}
