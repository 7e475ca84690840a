package twig.core.suite;

import twig.core.report.Reporter;
import twig.core.util.ObjectChecker;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * A suite whose tests are functions registered by name, usually from the constructor of a subclass:
 *
 * <pre>
 * public class StackSuite extends FunSuite {
 *     public StackSuite() {
 *         test("pop returns the last pushed element", () -> { ... });
 *         ignore("pop on an empty stack throws", () -> { ... });
 *     }
 * }
 * </pre>
 *
 * Tests run in registration order.
 */
public abstract class FunSuite extends Suite {
    private final TestRegistry registry = TestRegistry.empty();

    protected final void test(String testName, TestBody body) {
        test(testName, Collections.<String>emptySet(), body);
    }

    protected final void test(String testName, Set<String> tags, TestBody body) {
        this.registry.register(testName, tags, InformingTestBody.ignoringInformer(body));
    }

    /**
     * Registers a test whose body is handed an {@link Informer}.
     */
    protected final void testWithInformer(String testName, InformingTestBody body) {
        testWithInformer(testName, Collections.<String>emptySet(), body);
    }

    protected final void testWithInformer(String testName, Set<String> tags, InformingTestBody body) {
        this.registry.register(testName, tags, ObjectChecker.requireNonNull(body, "body"));
    }

    /**
     * Registers a test that is reported as ignored instead of being run.
     */
    protected final void ignore(String testName, TestBody body) {
        ignore(testName, Collections.<String>emptySet(), body);
    }

    protected final void ignore(String testName, Set<String> tags, TestBody body) {
        this.registry.registerIgnored(testName, tags, InformingTestBody.ignoringInformer(body));
    }

    final TestRegistry registry() {
        return this.registry;
    }

    @Override
    public Set<String> testNames() {
        return this.registry.testNames();
    }

    @Override
    public Map<String, Set<String>> tags() {
        return this.registry.tagsByTestName();
    }

    @Override
    public void runTest(String testName, Reporter reporter, Stopper stopper, Map<String, Object> configMap) {
        ObjectChecker.requireNonNull(testName, "testName");
        ObjectChecker.requireNonNull(reporter, "reporter");
        ObjectChecker.requireNonNull(stopper, "stopper");
        ObjectChecker.requireNonNull(configMap, "configMap");

        RegisteredTest test = this.registry.find(testName);
        runReportedTest(test.getName(), test.getInvocation(), reporter);
    }

    @Override
    protected void closeRegistration() {
        this.registry.closeRegistration();
    }
}
