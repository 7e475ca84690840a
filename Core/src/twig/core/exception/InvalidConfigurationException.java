package twig.core.exception;

/**
 * Thrown when a set of configuration parameters cannot be merged, for example because the same parameter was passed
 * more than once.
 */
public final class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
