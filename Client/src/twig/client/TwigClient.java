package twig.client;

import twig.client.output.ConsoleReporter;
import twig.core.config.JsonRunConfigurationParser;
import twig.core.config.RunConfiguration;
import twig.core.runner.RunOutcome;
import twig.core.runner.SuiteRunner;
import twig.core.suite.SimpleStopper;
import twig.core.type.Result;
import twig.core.util.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * A single-use client that runs the suites described by a run configuration file and then exits.
 */
public final class TwigClient {
    private static final Logger LOGGER = Logger.forClass(TwigClient.class);

    /**
     * We expect to be given exactly one argument:
     *
     * args[0] = the path to a JSON run configuration file, as read by {@link JsonRunConfigurationParser}.
     *
     * The following system properties are read:
     *
     * enable_logger: whether to print log output, defaults to false.
     * num_threads: the number of suites to run in parallel, overriding the run configuration if given.
     *
     * The process exits with status 0 iff every suite completed and no test failed.
     *
     * @param args The program arguments.
     */
    public static void main(String[] args) {
        int status;
        try {
            status = run(args);
        } catch (Throwable t) {
            System.err.println("Unexpected Error!");
            t.printStackTrace();
            status = 1;
        } finally {
            LOGGER.log("Exiting.");
        }
        System.exit(status);
    }

    /**
     * Runs the client and returns its exit status instead of exiting.
     *
     * @param args The program arguments.
     * @return the exit status.
     */
    public static int run(String[] args) throws IOException, InterruptedException {
        if (!Boolean.parseBoolean(System.getProperty("enable_logger"))) {
            Logger.globalDisable();
        }

        if ((args == null) || (args.length != 1)) {
            System.err.println(usage());
            return 1;
        }
        logArguments(args);

        String document = new String(Files.readAllBytes(Paths.get(args[0])), StandardCharsets.UTF_8);
        Result<RunConfiguration> parsed = new JsonRunConfigurationParser().parseRunConfiguration(document);
        if (!parsed.isSuccess()) {
            System.err.println(parsed.getError());
            return 1;
        }

        RunConfiguration configuration = parsed.getData();
        String numThreadsProperty = System.getProperty("num_threads");
        if (numThreadsProperty != null) {
            LOGGER.log("num_threads property: " + numThreadsProperty);
            configuration = configuration.withNumThreads(Integer.parseInt(numThreadsProperty));
        }
        LOGGER.log("Running with: " + configuration);

        ConsoleReporter reporter = ConsoleReporter.printingTo(System.out);
        RunOutcome outcome = SuiteRunner.withConfiguration(configuration).run(reporter, new SimpleStopper());
        LOGGER.log("Run outcome: " + outcome);

        return ((outcome == RunOutcome.COMPLETED) && reporter.isSuccess()) ? 0 : 1;
    }

    private static void logArguments(String[] args) {
        LOGGER.log("ARGS ------------------------------------------------");
        for (String a : args) {
            LOGGER.log(a);
        }
        LOGGER.log("ARGS ------------------------------------------------\n");
    }

    private static String usage() {
        return TwigClient.class.getName()
                + " <run configuration>"
                + "\n\trun configuration: a path to a JSON file naming the suites to run."
                + "\n\tsystem properties: -Denable_logger=<true|false> -Dnum_threads=<n>";
    }
}
