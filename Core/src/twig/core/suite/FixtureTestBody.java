package twig.core.suite;

/**
 * The body of a test that receives a fixture from {@link FixtureFunSuite#withFixture}.
 */
@FunctionalInterface
public interface FixtureTestBody<F> {

    public void run(F fixture) throws Throwable;
}
