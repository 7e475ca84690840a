package twig.core.spec;

import twig.core.suite.InformingTestBody;
import twig.core.suite.TagFilter;
import twig.core.util.ObjectChecker;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single test in a spec tree, declared with {@code it} or {@code ignore}.
 *
 * An ignored example carries {@link TagFilter#IGNORE_TAG} among its tags.
 */
public final class Example implements Node {
    private final Branch owner;
    private final String text;
    private final Set<String> tags;
    private final InformingTestBody body;

    Example(Branch owner, String text, Set<String> tags, boolean ignored, InformingTestBody body) {
        this.owner = ObjectChecker.requireNonNull(owner, "owner");
        this.text = ObjectChecker.requireNonNull(text, "text");
        this.body = ObjectChecker.requireNonNull(body, "body");
        ObjectChecker.requireNonNull(tags, "tags");

        Set<String> allTags = new LinkedHashSet<>(tags);
        if (ignored) {
            allTags.add(TagFilter.IGNORE_TAG);
        }
        this.tags = Collections.unmodifiableSet(allTags);
    }

    public String text() {
        return this.text;
    }

    public Set<String> tags() {
        return this.tags;
    }

    public InformingTestBody body() {
        return this.body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXAMPLE;
    }

    @Override
    public Branch owner() {
        return this.owner;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { text: " + this.text + ", tags: " + this.tags + " }";
    }
}
