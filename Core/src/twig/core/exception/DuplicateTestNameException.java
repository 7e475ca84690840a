package twig.core.exception;

/**
 * Thrown when a test is registered under a name that is already registered in the same suite.
 */
public final class DuplicateTestNameException extends IllegalArgumentException {
    private final String testName;

    public DuplicateTestNameException(String testName) {
        super("Duplicate test name: " + testName);
        this.testName = testName;
    }

    public String getTestName() {
        return this.testName;
    }
}
