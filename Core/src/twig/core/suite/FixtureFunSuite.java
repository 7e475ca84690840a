package twig.core.suite;

import java.util.Collections;
import java.util.Set;

/**
 * A {@link FunSuite} whose tests may take a fixture. Subclasses decide how the fixture is created and cleaned up by
 * implementing {@link #withFixture(FixtureTestBody)}, which is called once per fixture test.
 *
 * @param <F> The fixture type.
 */
public abstract class FixtureFunSuite<F> extends FunSuite {

    /**
     * Creates a fixture, passes it to the given test body and cleans it up afterwards. Anything thrown by the body must
     * be propagated for the test to fail.
     *
     * @param test The test body.
     */
    protected abstract void withFixture(FixtureTestBody<F> test) throws Throwable;

    protected final void test(String testName, FixtureTestBody<F> body) {
        test(testName, Collections.<String>emptySet(), body);
    }

    protected final void test(String testName, Set<String> tags, FixtureTestBody<F> body) {
        if (body == null) {
            throw new NullPointerException("body was null");
        }
        registry().register(testName, tags, (informer) -> withFixture(body));
    }

    protected final void ignore(String testName, FixtureTestBody<F> body) {
        if (body == null) {
            throw new NullPointerException("body was null");
        }
        registry().registerIgnored(testName, Collections.<String>emptySet(), (informer) -> withFixture(body));
    }
}
