package twig.core.spec;

import twig.core.exception.NoSuchSharedBehaviorException;
import twig.core.suite.TagFilter;
import twig.core.util.ObjectChecker;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a spec tree in declaration order and hands every reachable example, with its full name, to a {@link Visitor}.
 *
 * Descriptions are descended into and add their text to the name prefix. Shared behavior declarations are skipped.
 * Shared behavior invocations are resolved from the invoking branch outwards, and the behavior's subtree is walked with
 * the invocation site's prefix, so one behavior invoked in two places yields two sets of examples.
 */
public final class SpecRunner {

    private SpecRunner() {}

    /**
     * Receives the events of a walk.
     */
    public interface Visitor {

        /**
         * Called before the children of a branch are walked.
         */
        public void enterBranch(Branch branch);

        public void visitExample(Example example, String fullName);

        /**
         * Called after the children of a branch were walked, unless the walk was stopped.
         */
        public void exitBranch(Branch branch);

        /**
         * Polled before each child; once true the walk ends.
         */
        public boolean isDone();
    }

    /**
     * Walks the tree below the given trunk.
     *
     * @param trunk The root of the tree.
     * @param visitor The visitor.
     * @throws NoSuchSharedBehaviorException if an invocation cannot be resolved.
     */
    public static void walk(Trunk trunk, Visitor visitor) {
        ObjectChecker.assertNonNull(trunk, visitor);
        walk(trunk, "", visitor, new ArrayDeque<SharedBehavior>());
    }

    /**
     * Returns the name of an example declared with the given text below the given prefix.
     */
    public static String exampleName(String prefix, String text) {
        return prefix.isEmpty() ? "It should " + text : prefix + " should " + text;
    }

    /**
     * Returns the prefix for the children of a description with the given text below the given prefix.
     */
    public static String descriptionPrefix(String prefix, String text) {
        return prefix.isEmpty() ? text : prefix + " " + text;
    }

    /**
     * Returns the tags of every example by full name, in walk order. Where several examples share a name the first one
     * wins.
     */
    public static Map<String, Set<String>> tagsByFullName(Trunk trunk) {
        Map<String, Set<String>> tagsByName = new LinkedHashMap<>();
        walk(trunk, new CollectingVisitor() {
            @Override
            public void visitExample(Example example, String fullName) {
                if (!tagsByName.containsKey(fullName)) {
                    tagsByName.put(fullName, example.tags());
                }
            }
        });
        return Collections.unmodifiableMap(tagsByName);
    }

    /**
     * Returns the number of examples the walk reaches that pass the tag filter.
     */
    public static int countRunnable(Trunk trunk, Set<String> includes, Set<String> excludes) {
        int[] count = {0};
        walk(trunk, new CollectingVisitor() {
            @Override
            public void visitExample(Example example, String fullName) {
                if (TagFilter.shouldRun(example.tags(), includes, excludes)) {
                    count[0]++;
                }
            }
        });
        return count[0];
    }

    /**
     * Returns the first example reached with the given full name.
     */
    public static Optional<Example> findExample(Trunk trunk, String fullName) {
        Example[] found = {null};
        walk(trunk, new CollectingVisitor() {
            @Override
            public void visitExample(Example example, String name) {
                if ((found[0] == null) && name.equals(fullName)) {
                    found[0] = example;
                }
            }

            @Override
            public boolean isDone() {
                return found[0] != null;
            }
        });
        return Optional.ofNullable(found[0]);
    }

    private static void walk(Branch branch, String prefix, Visitor visitor, Deque<SharedBehavior> activeBehaviors) {
        visitor.enterBranch(branch);
        for (Node child : branch.children()) {
            if (visitor.isDone()) {
                return;
            }
            switch (child.kind()) {
                case EXAMPLE:
                    Example example = (Example) child;
                    visitor.visitExample(example, exampleName(prefix, example.text()));
                    break;
                case DESCRIPTION:
                    Description description = (Description) child;
                    walk(description, descriptionPrefix(prefix, description.text()), visitor, activeBehaviors);
                    break;
                case SHARED_BEHAVIOR:
                    break;
                case SHARED_BEHAVIOR_INVOCATION:
                    SharedBehaviorInvocation invocation = (SharedBehaviorInvocation) child;
                    SharedBehavior behavior = SpecBuilder.resolve(invocation.owner(), invocation.behaviorName())
                            .orElseThrow(() -> new NoSuchSharedBehaviorException(invocation.behaviorName()));
                    if (activeBehaviors.contains(behavior)) {
                        throw new IllegalStateException("Shared behavior '" + behavior.name() + "' invokes itself.");
                    }
                    activeBehaviors.push(behavior);
                    try {
                        walk(behavior, prefix, visitor, activeBehaviors);
                    } finally {
                        activeBehaviors.pop();
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown node kind: " + child.kind());
            }
        }
        if (!visitor.isDone()) {
            visitor.exitBranch(branch);
        }
    }

    /**
     * A visitor that ignores branches and never stops early.
     */
    private abstract static class CollectingVisitor implements Visitor {

        @Override
        public void enterBranch(Branch branch) {
        }

        @Override
        public void exitBranch(Branch branch) {
        }

        @Override
        public boolean isDone() {
            return false;
        }
    }
}
