package twig.core.suite;

/**
 * The body of a test. A body that returns normally succeeds, one that throws fails.
 */
@FunctionalInterface
public interface TestBody {

    public void run() throws Throwable;
}
