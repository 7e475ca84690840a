package twig.core.report;

import java.time.Instant;
import java.util.Optional;

/**
 * An immutable description of one occurrence in the lifecycle of a run, suite or test, handed to a {@link Reporter}.
 *
 * {@link Report#getName()}: the name of the entity the report is about, for tests this is "suite name: test name".
 * {@link Report#getMessage()}: a message, empty for most starting and succeeded reports.
 * {@link Report#getCause()}: the error that caused a failure or abort, if any.
 * {@link Report#getRerunner()}: a descriptor that can be used to rerun the entity, if one could be created.
 * {@link Report#getThreadName()}: the name of the thread that created the report.
 * {@link Report#getTimestamp()}: the time at which the report was created.
 */
public final class Report {
    private final String name;
    private final String message;
    private final Optional<Throwable> cause;
    private final Optional<Rerunner> rerunner;
    private final String threadName;
    private final Instant timestamp;

    public Report(String name, String message, Optional<Throwable> cause, Optional<Rerunner> rerunner, String threadName, Instant timestamp) {
        if (name == null) {
            throw new NullPointerException("name was null");
        }
        if (message == null) {
            throw new NullPointerException("message was null");
        }
        if (cause == null) {
            throw new NullPointerException("cause was null");
        }
        if (rerunner == null) {
            throw new NullPointerException("rerunner was null");
        }
        if (threadName == null) {
            throw new NullPointerException("threadName was null");
        }
        if (timestamp == null) {
            throw new NullPointerException("timestamp was null");
        }
        this.name = name;
        this.message = message;
        this.cause = cause;
        this.rerunner = rerunner;
        this.threadName = threadName;
        this.timestamp = timestamp;
    }

    /**
     * Returns a new report with no cause and no rerunner, stamped with the current thread and time.
     *
     * @param name The name of the entity being reported on.
     * @param message The report message.
     * @return the new report.
     */
    public static Report of(String name, String message) {
        return new Report(name, message, Optional.empty(), Optional.empty(), Thread.currentThread().getName(), Instant.now());
    }

    /**
     * Returns a new report stamped with the current thread and time.
     *
     * @param name The name of the entity being reported on.
     * @param message The report message.
     * @param cause The cause, if any.
     * @param rerunner The rerunner, if any.
     * @return the new report.
     */
    public static Report of(String name, String message, Optional<Throwable> cause, Optional<Rerunner> rerunner) {
        return new Report(name, message, cause, rerunner, Thread.currentThread().getName(), Instant.now());
    }

    public String getName() {
        return this.name;
    }

    public String getMessage() {
        return this.message;
    }

    public Optional<Throwable> getCause() {
        return this.cause;
    }

    public Optional<Rerunner> getRerunner() {
        return this.rerunner;
    }

    public String getThreadName() {
        return this.threadName;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.name
                + ", message: " + this.message
                + ", " + (this.cause.isPresent() ? "cause: " + this.cause.get() : "no cause")
                + ", thread: " + this.threadName + " }";
    }
}
