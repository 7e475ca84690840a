package twig.core.runner;

/**
 * How a run ended.
 */
public enum RunOutcome {
    /** Every suite was executed. */
    COMPLETED,
    /** The stopper requested a stop before every suite was executed. */
    STOPPED,
    /** The run could not be started or a worker crashed. */
    ABORTED
}
