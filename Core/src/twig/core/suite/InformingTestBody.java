package twig.core.suite;

/**
 * The body of a test that is handed an {@link Informer} for the run it executes in.
 *
 * Every kind of test body is adapted into this one when it is registered.
 */
@FunctionalInterface
public interface InformingTestBody {

    public void run(Informer informer) throws Throwable;

    /**
     * Adapts a body that does not need an informer.
     */
    public static InformingTestBody ignoringInformer(TestBody body) {
        if (body == null) {
            throw new NullPointerException("body was null");
        }
        return (informer) -> body.run();
    }
}
