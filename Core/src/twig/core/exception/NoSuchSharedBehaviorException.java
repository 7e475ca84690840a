package twig.core.exception;

import java.util.NoSuchElementException;

/**
 * Thrown when a shared behavior is invoked by name but no shared behavior with that name exists in the invoking scope or
 * any of its enclosing scopes.
 */
public final class NoSuchSharedBehaviorException extends NoSuchElementException {
    private final String behaviorName;

    public NoSuchSharedBehaviorException(String behaviorName) {
        super("A requested shared behavior was not found: " + behaviorName);
        this.behaviorName = behaviorName;
    }

    public String getBehaviorName() {
        return this.behaviorName;
    }
}
