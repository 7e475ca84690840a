package twig.core.exception;

import java.util.ConcurrentModificationException;

/**
 * Thrown when two threads register tests on the same suite at the same time and one of them loses the race.
 *
 * Registration is expected to happen on a single thread while the suite is being constructed, so this always indicates
 * misuse and is never retried.
 */
public final class ConcurrentRegistrationException extends ConcurrentModificationException {

    public ConcurrentRegistrationException(String message) {
        super(message);
    }
}
