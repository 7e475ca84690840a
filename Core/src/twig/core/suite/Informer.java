package twig.core.suite;

/**
 * Lets a running test send informational messages to the reporters of the run.
 */
@FunctionalInterface
public interface Informer {

    public void info(String message);
}
