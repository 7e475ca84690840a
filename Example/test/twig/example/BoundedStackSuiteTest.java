package twig.example;

import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.runner.RunWith;
import twig.core.junit.JUnitSuiteRunner;
import twig.core.suite.FunSuite;

import java.util.Collections;
import java.util.NoSuchElementException;

@RunWith(JUnitSuiteRunner.class)
public class BoundedStackSuiteTest extends FunSuite {

    public BoundedStackSuiteTest() {
        test("a new stack is empty", () -> {
            BoundedStack<String> stack = BoundedStack.withCapacity(3);
            Assert.assertTrue(stack.isEmpty());
            Assert.assertEquals(0, stack.size());
        });

        test("pop returns elements in reverse push order", () -> {
            BoundedStack<Integer> stack = BoundedStack.withCapacity(3);
            stack.push(1);
            stack.push(2);
            stack.push(3);
            Assert.assertEquals(Integer.valueOf(3), stack.pop());
            Assert.assertEquals(Integer.valueOf(2), stack.pop());
            Assert.assertEquals(Integer.valueOf(1), stack.pop());
        });

        test("pop on an empty stack throws", Collections.singleton("edge"), () -> {
            BoundedStack<String> stack = BoundedStack.withCapacity(1);
            try {
                stack.pop();
                Assert.fail("Expected pop to throw.");
            } catch (NoSuchElementException e) {
                Assert.assertThat(e.getMessage(), Matchers.containsString("empty"));
            }
        });

        testWithInformer("push on a full stack throws", (informer) -> {
            BoundedStack<String> stack = BoundedStack.withCapacity(1);
            stack.push("only");
            informer.info("stack is full: " + stack.isFull());
            try {
                stack.push("one too many");
                Assert.fail("Expected push to throw.");
            } catch (IllegalStateException e) {
                Assert.assertEquals(1, stack.size());
            }
        });

        ignore("a stack can grow past its capacity", () -> {
            BoundedStack<String> stack = BoundedStack.withCapacity(1);
            stack.push("a");
            stack.push("b");
        });

        test("peek does not remove", () -> pending());
    }
}
