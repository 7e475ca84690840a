package twig.core.runner;

import twig.core.config.RunConfiguration;
import twig.core.report.DispatchReporter;
import twig.core.report.Report;
import twig.core.report.Reporter;
import twig.core.suite.Stopper;
import twig.core.suite.Suite;
import twig.core.util.CloseableBlockingQueue;
import twig.core.util.Logger;
import twig.core.util.ObjectChecker;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs a list of suites on a pool of {@link SuiteExecutor} threads.
 *
 * The run reports {@link Reporter#runStarting} with the total expected test count, hands the suites out to the
 * executors round-robin, waits for every executor to finish and then reports exactly one of
 * {@link Reporter#runCompleted}, {@link Reporter#runStopped} or {@link Reporter#runAborted}. Finally the reporter is
 * disposed.
 *
 * All executors report through a single {@link DispatchReporter}, so the given reporter only ever receives events from
 * one thread.
 */
public final class SuiteRunner {
    private static final Logger LOGGER = Logger.forClass(SuiteRunner.class);
    private static final int QUEUE_CAPACITY = 100;
    private final RunConfiguration configuration;
    private final ClassLoader classLoader;

    private SuiteRunner(RunConfiguration configuration, ClassLoader classLoader) {
        ObjectChecker.assertNonNull(configuration, classLoader);
        this.configuration = configuration;
        this.classLoader = classLoader;
    }

    /**
     * Constructs a runner that loads the configured suite classes with the given class loader.
     *
     * @param configuration The run configuration.
     * @param classLoader The class loader to load the suite classes with.
     * @return the new runner.
     */
    public static SuiteRunner withConfiguration(RunConfiguration configuration, ClassLoader classLoader) {
        return new SuiteRunner(configuration, classLoader);
    }

    /**
     * Constructs a runner that loads the configured suite classes with the context class loader of the calling thread.
     *
     * @param configuration The run configuration.
     * @return the new runner.
     */
    public static SuiteRunner withConfiguration(RunConfiguration configuration) {
        return new SuiteRunner(configuration, Thread.currentThread().getContextClassLoader());
    }

    /**
     * Loads and instantiates the configured suites and runs them.
     *
     * @param reporter The reporter of the run. It is disposed once the run ends.
     * @param stopper The stopper of the run.
     * @return how the run ended.
     */
    public RunOutcome run(Reporter reporter, Stopper stopper) throws InterruptedException {
        ObjectChecker.assertNonNull(reporter, stopper);

        List<Suite> suites;
        try {
            suites = loadSuites();
        } catch (ReflectiveOperationException | RuntimeException e) {
            LOGGER.log("Failed to load suites.", e);
            DispatchReporter dispatchReporter = DispatchReporter.dispatchingTo(reporter);
            dispatchReporter.runAborted(Report.of("Run", "Failed to load suites: " + e, Optional.<Throwable>of(e), Optional.empty()));
            dispatchReporter.dispose();
            return RunOutcome.ABORTED;
        }
        return runSuites(suites, reporter, stopper);
    }

    /**
     * Runs the given, already instantiated, suites with the settings of this runner's configuration. The suite class
     * names of the configuration are not used.
     *
     * @param suites The suites to run.
     * @param reporter The reporter of the run. It is disposed once the run ends.
     * @param stopper The stopper of the run.
     * @return how the run ended.
     */
    public RunOutcome runSuites(List<Suite> suites, Reporter reporter, Stopper stopper) throws InterruptedException {
        ObjectChecker.assertNonNull(suites, reporter, stopper);

        DispatchReporter dispatchReporter = DispatchReporter.dispatchingTo(reporter);
        try {
            int expectedTestCount = 0;
            for (Suite suite : suites) {
                expectedTestCount += suite.expectedTestCount(this.configuration.getIncludeTags(), this.configuration.getExcludeTags());
            }
            dispatchReporter.runStarting(expectedTestCount);
            LOGGER.log("Running " + suites.size() + " suites expecting " + expectedTestCount + " tests.");

            PanicMonitor panicMonitor = new PanicMonitor();
            List<CloseableBlockingQueue<Suite>> suiteQueues = createSuiteQueues(this.configuration.getNumThreads());
            List<SuiteExecutor> executors = createExecutors(suiteQueues, dispatchReporter, stopper, panicMonitor);
            List<Thread> executorThreads = createExecutorThreads(executors);
            startThreads(executorThreads);

            try {
                submitSuites(suites, suiteQueues, panicMonitor);
            } catch (InterruptedException | RuntimeException e) {
                shutdownExecutors(executors);
                throw e;
            } finally {
                closeQueues(suiteQueues);
                joinThreads(executorThreads);
            }

            if (panicMonitor.isPanic()) {
                Throwable cause = panicMonitor.getPanicCause();
                LOGGER.log("Run aborted.", cause);
                dispatchReporter.runAborted(Report.of("Run", "A suite executor crashed: " + cause, Optional.of(cause), Optional.empty()));
                return RunOutcome.ABORTED;
            } else if (stopper.stopRequested()) {
                dispatchReporter.runStopped();
                return RunOutcome.STOPPED;
            } else {
                dispatchReporter.runCompleted();
                return RunOutcome.COMPLETED;
            }
        } finally {
            dispatchReporter.dispose();
        }
    }

    private List<Suite> loadSuites() throws ReflectiveOperationException {
        List<Suite> suites = new ArrayList<>();
        for (String className : this.configuration.getSuiteClassNames()) {
            LOGGER.log("Loading suite class: " + className);
            Class<?> suiteClass = Class.forName(className, true, this.classLoader);
            if (!Suite.class.isAssignableFrom(suiteClass)) {
                throw new ClassCastException(className + " is not a " + Suite.class.getName());
            }
            try {
                suites.add((Suite) suiteClass.getConstructor().newInstance());
            } catch (InvocationTargetException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }
        return Collections.unmodifiableList(suites);
    }

    private void submitSuites(List<Suite> suites, List<CloseableBlockingQueue<Suite>> suiteQueues, PanicMonitor panicMonitor) throws InterruptedException {
        int index = 0;
        for (Suite suite : suites) {
            if (panicMonitor.isPanic()) {
                break;
            }
            CloseableBlockingQueue<Suite> queue = suiteQueues.get(index % suiteQueues.size());
            if (!queue.add(suite)) {
                throw new IllegalStateException("Failed to submit suite: " + suite.suiteName());
            }
            LOGGER.log("Submitted suite #" + (index + 1) + " of " + suites.size());
            index++;
        }
    }

    private static List<CloseableBlockingQueue<Suite>> createSuiteQueues(int numQueues) {
        List<CloseableBlockingQueue<Suite>> queues = new ArrayList<>();
        for (int i = 0; i < numQueues; i++) {
            queues.add(CloseableBlockingQueue.withCapacity(QUEUE_CAPACITY));
        }
        return queues;
    }

    private List<SuiteExecutor> createExecutors(List<CloseableBlockingQueue<Suite>> suiteQueues, Reporter reporter, Stopper stopper, PanicMonitor panicMonitor) {
        List<SuiteExecutor> executors = new ArrayList<>();
        for (CloseableBlockingQueue<Suite> suiteQueue : suiteQueues) {
            executors.add(SuiteExecutor.withQueue(suiteQueue, reporter, stopper, panicMonitor,
                    this.configuration.getTestName(),
                    this.configuration.getIncludeTags(),
                    this.configuration.getExcludeTags(),
                    this.configuration.getConfigMap()));
        }
        return executors;
    }

    private static List<Thread> createExecutorThreads(List<SuiteExecutor> executors) {
        List<Thread> threads = new ArrayList<>();

        int index = 0;
        for (SuiteExecutor executor : executors) {
            threads.add(new Thread(executor, "SuiteExecutor-" + index));
            index++;
        }
        return threads;
    }

    private static void startThreads(List<Thread> threads) {
        for (Thread thread : threads) {
            thread.start();
        }
    }

    private static void shutdownExecutors(List<SuiteExecutor> executors) {
        for (SuiteExecutor executor : executors) {
            executor.shutdown();
        }
    }

    private static void closeQueues(List<CloseableBlockingQueue<Suite>> queues) {
        for (CloseableBlockingQueue<Suite> queue : queues) {
            queue.close();
        }
    }

    private static void joinThreads(List<Thread> threads) throws InterruptedException {
        for (Thread thread : threads) {
            thread.join();
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.configuration + " }";
    }
}
