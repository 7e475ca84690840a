package twig.core.exception;

/**
 * Thrown by a test body to indicate that the test has been written down but not yet implemented. A test that ends this
 * way is reported as pending rather than failed.
 */
public final class TestPendingException extends RuntimeException {

    public TestPendingException() {
        super("Test is pending.");
    }
}
