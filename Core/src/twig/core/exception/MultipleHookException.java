package twig.core.exception;

/**
 * Thrown when the same kind of hook (before each, after each, before all or after all) is given twice to the same
 * describe or share clause.
 */
public final class MultipleHookException extends IllegalStateException {

    public MultipleHookException(String hookName) {
        super("Multiple '" + hookName + "' clauses found in same describe or share clause.");
    }
}
