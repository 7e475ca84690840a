package twig.core.suite;

import org.junit.Assert;
import org.junit.Test;
import twig.core.exception.TestPendingException;

import java.io.IOException;

public class TestInvokerTest {
    private static final Informer SILENT = (message) -> {};

    @Test
    public void testSuccess() {
        TestOutcome outcome = TestInvoker.invoke((informer) -> {}, SILENT);
        Assert.assertEquals(TestOutcome.Kind.SUCCEEDED, outcome.getKind());
        Assert.assertFalse(outcome.getCause().isPresent());
    }

    @Test
    public void testCheckedExceptionFails() {
        IOException error = new IOException("disk gone");
        TestOutcome outcome = TestInvoker.invoke((informer) -> {
            throw error;
        }, SILENT);
        Assert.assertEquals(TestOutcome.Kind.FAILED, outcome.getKind());
        Assert.assertSame(error, outcome.getCause().get());
        Assert.assertEquals("disk gone", outcome.failureMessage());
    }

    @Test
    public void testAssertionErrorFails() {
        TestOutcome outcome = TestInvoker.invoke((informer) -> Assert.assertEquals(1, 2), SILENT);
        Assert.assertEquals(TestOutcome.Kind.FAILED, outcome.getKind());
        Assert.assertTrue(outcome.getCause().get() instanceof AssertionError);
    }

    @Test
    public void testPendingException() {
        TestOutcome outcome = TestInvoker.invoke((informer) -> {
            throw new TestPendingException();
        }, SILENT);
        Assert.assertEquals(TestOutcome.Kind.PENDING, outcome.getKind());
    }

    @Test
    public void testErrorsFail() {
        Error error = new Error("boom");
        TestOutcome outcome = TestInvoker.invoke((informer) -> {
            throw error;
        }, SILENT);
        Assert.assertEquals(TestOutcome.Kind.FAILED, outcome.getKind());
        Assert.assertSame(error, outcome.getCause().get());
        Assert.assertEquals("boom", outcome.failureMessage());
    }

    @Test
    public void testStackOverflowFails() {
        TestOutcome outcome = TestInvoker.invoke((informer) -> recurse(0), SILENT);
        Assert.assertEquals(TestOutcome.Kind.FAILED, outcome.getKind());
        Assert.assertTrue(outcome.getCause().get() instanceof StackOverflowError);
    }

    @Test
    public void testLinkageErrorFails() {
        TestOutcome outcome = TestInvoker.invoke((informer) -> {
            throw new NoClassDefFoundError("com/acme/Missing");
        }, SILENT);
        Assert.assertEquals(TestOutcome.Kind.FAILED, outcome.getKind());
        Assert.assertEquals("com/acme/Missing", outcome.failureMessage());
    }

    private static int recurse(int depth) {
        return recurse(depth + 1) + 1;
    }
}
