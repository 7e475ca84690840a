package twig.core.util;

/**
 * A simple logging utility that can be either enabled or disabled globally.
 */
public final class Logger {
    private static volatile boolean globalEnabled = true;
    private final String className;
    private volatile boolean enabled = true;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    /**
     * Disables this logger only.
     */
    public void disable() {
        this.enabled = false;
    }

    /**
     * Enables this logger only. It still logs nothing while loggers are globally disabled.
     */
    public void enable() {
        this.enabled = true;
    }

    public boolean isEnabled() {
        return globalEnabled && this.enabled;
    }

    /**
     * Logs the specified message to stdout if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (isEnabled()) {
            System.out.println(this.className + ": " + message);
        }
    }

    /**
     * Logs the specified message followed by the stack trace of the given error if logging is enabled.
     *
     * @param message The message to log.
     * @param error The error whose stack trace to log.
     */
    public void log(String message, Throwable error) {
        if (isEnabled()) {
            System.out.println(this.className + ": " + message);
            error.printStackTrace(System.out);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled (global): " + globalEnabled + ", enabled (local): " + this.enabled + " }";
    }
}
