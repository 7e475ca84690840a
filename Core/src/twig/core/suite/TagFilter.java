package twig.core.suite;

import java.util.Set;

/**
 * Decides whether a test should run given its tags and the include and exclude tag sets of a run.
 */
public final class TagFilter {
    /**
     * The tag implicitly carried by every ignored test.
     */
    public static final String IGNORE_TAG = "twig.Ignore";

    private TagFilter() {}

    /**
     * Returns true iff a test carrying the given tags should run.
     *
     * With an empty include set a test runs iff it carries none of the exclude tags. With a non-empty include set a test
     * runs iff it carries at least one of the include tags and none of the exclude tags.
     *
     * @param testTags The tags of the test.
     * @param include The tags to include.
     * @param exclude The tags to exclude.
     * @return whether the test should run.
     */
    public static boolean shouldRun(Set<String> testTags, Set<String> include, Set<String> exclude) {
        if (testTags == null) {
            throw new NullPointerException("testTags was null");
        }
        if (include == null) {
            throw new NullPointerException("include was null");
        }
        if (exclude == null) {
            throw new NullPointerException("exclude was null");
        }
        if (!include.isEmpty() && !containsAny(testTags, include)) {
            return false;
        }
        return !containsAny(testTags, exclude);
    }

    /**
     * Returns true iff the test is to be reported as ignored rather than run: it carries {@link #IGNORE_TAG} and that
     * tag is excluded.
     */
    public static boolean isReportedIgnored(Set<String> testTags, Set<String> exclude) {
        return exclude.contains(IGNORE_TAG) && testTags.contains(IGNORE_TAG);
    }

    /**
     * Returns true iff the test passes the include set, which is the precondition for it to be either run or reported as
     * ignored.
     */
    public static boolean isIncluded(Set<String> testTags, Set<String> include) {
        return include.isEmpty() || containsAny(testTags, include);
    }

    private static boolean containsAny(Set<String> tags, Set<String> candidates) {
        for (String candidate : candidates) {
            if (tags.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
