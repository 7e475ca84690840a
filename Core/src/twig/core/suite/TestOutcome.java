package twig.core.suite;

import java.util.Optional;

/**
 * How a single test body ended.
 */
public final class TestOutcome {
    private static final TestOutcome SUCCEEDED = new TestOutcome(Kind.SUCCEEDED, null);
    private static final TestOutcome PENDING = new TestOutcome(Kind.PENDING, null);
    private final Kind kind;
    private final Throwable cause;

    public enum Kind { SUCCEEDED, FAILED, PENDING }

    private TestOutcome(Kind kind, Throwable cause) {
        this.kind = kind;
        this.cause = cause;
    }

    public static TestOutcome succeeded() {
        return SUCCEEDED;
    }

    public static TestOutcome pending() {
        return PENDING;
    }

    public static TestOutcome failed(Throwable cause) {
        if (cause == null) {
            throw new NullPointerException("cause was null");
        }
        return new TestOutcome(Kind.FAILED, cause);
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the error that failed the test. Present iff the kind is {@link Kind#FAILED}.
     */
    public Optional<Throwable> getCause() {
        return Optional.ofNullable(this.cause);
    }

    /**
     * Returns the message to report for a failure: the message of the cause if it has one, otherwise the cause's string
     * form.
     */
    public String failureMessage() {
        if (this.cause == null) {
            return "";
        }
        return (this.cause.getMessage() != null) ? this.cause.getMessage() : this.cause.toString();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.kind + ((this.cause == null) ? " }" : ", cause: " + this.cause + " }");
    }
}
