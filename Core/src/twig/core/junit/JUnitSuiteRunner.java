package twig.core.junit;

import org.junit.runner.Description;
import org.junit.runner.Runner;
import org.junit.runner.notification.Failure;
import org.junit.runner.notification.RunNotifier;
import org.junit.runners.model.InitializationError;
import twig.core.suite.Stopper;
import twig.core.suite.Suite;
import twig.core.suite.TagFilter;
import twig.core.util.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a Twig suite from a JUnit 4 build. Annotate the suite class with {@code @RunWith(JUnitSuiteRunner.class)}:
 *
 * <pre>
 * &#64;RunWith(JUnitSuiteRunner.class)
 * public class StackSuiteTest extends FunSuite { ... }
 * </pre>
 *
 * Every test of the suite, and of its nested suites, becomes a child of the suite's {@link Description}. Ignored tests
 * are excluded and reported to JUnit as ignored.
 */
public final class JUnitSuiteRunner extends Runner {
    private static final Logger LOGGER = Logger.forClass(JUnitSuiteRunner.class);
    private static final Set<String> INCLUDES = Collections.emptySet();
    private static final Set<String> EXCLUDES = Collections.singleton(TagFilter.IGNORE_TAG);
    private final Class<?> suiteClass;
    private final Suite suite;
    private final Map<String, Description> descriptionsByReportName = new LinkedHashMap<>();
    private final Description description;

    /**
     * Called by JUnit with the class annotated with {@code @RunWith(JUnitSuiteRunner.class)}.
     *
     * @param suiteClass The suite class, which must extend {@link Suite} and have a public no-arg constructor.
     * @throws InitializationError if the suite cannot be instantiated.
     */
    public JUnitSuiteRunner(Class<?> suiteClass) throws InitializationError {
        if (!Suite.class.isAssignableFrom(suiteClass)) {
            throw new InitializationError(suiteClass.getName() + " must extend " + Suite.class.getName() + " to be run with " + JUnitSuiteRunner.class.getSimpleName() + ".");
        }
        this.suiteClass = suiteClass;
        try {
            this.suite = (Suite) suiteClass.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new InitializationError(e);
        }
        this.description = describe(this.suite);
    }

    @Override
    public Description getDescription() {
        return this.description;
    }

    @Override
    public void run(RunNotifier notifier) {
        LOGGER.log("Running " + this.suiteClass.getName() + " under JUnit.");
        try {
            this.suite.execute(Optional.<String>empty(), new RunNotifierReporter(notifier, this.description, this.descriptionsByReportName), Stopper.NEVER, INCLUDES, EXCLUDES, Collections.<String, Object>emptyMap());
        } catch (RuntimeException e) {
            LOGGER.log("Suite aborted: " + this.suiteClass.getName(), e);
            notifier.fireTestFailure(new Failure(this.description, e));
        }
    }

    @Override
    public int testCount() {
        return this.suite.expectedTestCount(INCLUDES, EXCLUDES);
    }

    private Description describe(Suite described) {
        Description suiteDescription = Description.createSuiteDescription(described.getClass());
        for (Suite nested : described.nestedSuites()) {
            suiteDescription.addChild(describe(nested));
        }
        for (String testName : described.testNames()) {
            Description testDescription = Description.createTestDescription(described.getClass(), testName);
            suiteDescription.addChild(testDescription);
            this.descriptionsByReportName.put(described.testNameForReport(testName), testDescription);
        }
        return suiteDescription;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + this.suiteClass.getName() + " }";
    }
}
