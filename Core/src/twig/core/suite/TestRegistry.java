package twig.core.suite;

import twig.core.exception.ConcurrentRegistrationException;
import twig.core.exception.DuplicateTestNameException;
import twig.core.exception.UnknownTestNameException;
import twig.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the named, tagged tests of one suite.
 *
 * The registry state is an immutable {@link Bundle} published through an {@link AtomicReference}. Every registration
 * builds a new bundle from the one it read and swaps it in with a single compare-and-set. Registration is expected to
 * happen on one thread while the suite is constructed, so a failed swap means two threads registered at once and is
 * reported as a {@link ConcurrentRegistrationException} instead of being retried. Readers always see a consistent
 * bundle without locking.
 *
 * This class is thread-safe.
 */
public final class TestRegistry {
    private final AtomicReference<Bundle> bundle;

    private TestRegistry(AtomicReference<Bundle> bundle) {
        this.bundle = bundle;
    }

    public static TestRegistry empty() {
        return new TestRegistry(new AtomicReference<>(Bundle.EMPTY));
    }

    /**
     * Returns a registry that publishes its bundles through the given reference, which must hold a bundle.
     */
    static TestRegistry withBundleReference(AtomicReference<Bundle> bundle) {
        ObjectChecker.requireNonNull(bundle, "bundle");
        ObjectChecker.requireNonNull(bundle.get(), "bundle value");
        return new TestRegistry(bundle);
    }

    /**
     * Registers a test.
     *
     * @param name The unique name of the test.
     * @param tags The tags of the test.
     * @param invocation The body of the test.
     * @throws DuplicateTestNameException if a test with this name is already registered.
     * @throws ConcurrentRegistrationException if another thread registered a test at the same time.
     * @throws IllegalStateException if registration has been closed.
     */
    public void register(String name, Set<String> tags, InformingTestBody invocation) {
        publish(RegisteredTest.of(name, tags, invocation));
    }

    /**
     * Registers a test that carries {@link TagFilter#IGNORE_TAG} in addition to the given tags.
     *
     * @param name The unique name of the test.
     * @param tags The tags of the test.
     * @param invocation The body of the test.
     */
    public void registerIgnored(String name, Set<String> tags, InformingTestBody invocation) {
        ObjectChecker.requireNonNull(tags, "tags");
        Set<String> tagsWithIgnore = new LinkedHashSet<>(tags);
        tagsWithIgnore.add(TagFilter.IGNORE_TAG);
        publish(RegisteredTest.of(name, tagsWithIgnore, invocation));
    }

    /**
     * Returns the names of all registered tests, oldest registration first.
     *
     * @return the test names.
     */
    public Set<String> testNames() {
        List<String> newestFirst = this.bundle.get().namesNewestFirst;
        Set<String> names = new LinkedHashSet<>();
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            names.add(newestFirst.get(i));
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Returns the tags of every test that has at least one tag.
     *
     * @return an unmodifiable snapshot of the tags by test name.
     */
    public Map<String, Set<String>> tagsByTestName() {
        return this.bundle.get().tagsByName;
    }

    /**
     * Returns the test registered under the given name.
     *
     * @param name The test name.
     * @return the test.
     * @throws UnknownTestNameException if no such test is registered.
     */
    public RegisteredTest find(String name) {
        ObjectChecker.requireNonNull(name, "testName");
        RegisteredTest test = this.bundle.get().testsByName.get(name);
        if (test == null) {
            throw new UnknownTestNameException(name);
        }
        return test;
    }

    public int size() {
        return this.bundle.get().namesNewestFirst.size();
    }

    /**
     * Forbids any further registration. Closing an already closed registry has no effect.
     */
    public void closeRegistration() {
        Bundle current = this.bundle.get();
        while (!current.registrationClosed) {
            if (this.bundle.compareAndSet(current, current.closed())) {
                return;
            }
            current = this.bundle.get();
        }
    }

    public boolean isRegistrationClosed() {
        return this.bundle.get().registrationClosed;
    }

    private void publish(RegisteredTest test) {
        Bundle current = this.bundle.get();
        if (current.registrationClosed) {
            throw new IllegalStateException("Cannot register test '" + test.getName() + "' after the suite has started executing.");
        }
        if (current.testsByName.containsKey(test.getName())) {
            throw new DuplicateTestNameException(test.getName());
        }
        if (!this.bundle.compareAndSet(current, current.with(test))) {
            throw new ConcurrentRegistrationException("Test '" + test.getName() + "' was registered concurrently with another test. Tests must be registered from a single thread.");
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + size() + (isRegistrationClosed() ? ", [closed] }" : ", [open] }");
    }

    /**
     * An immutable snapshot of a registry.
     *
     * The names are kept newest first. The key set of the tests map always equals the set of names, and a test only has
     * an entry in the tags map when it has at least one tag.
     */
    static final class Bundle {
        static final Bundle EMPTY = new Bundle(Collections.<String>emptyList(), Collections.<String, RegisteredTest>emptyMap(), Collections.<String, Set<String>>emptyMap(), false);
        final List<String> namesNewestFirst;
        final Map<String, RegisteredTest> testsByName;
        final Map<String, Set<String>> tagsByName;
        final boolean registrationClosed;

        private Bundle(List<String> namesNewestFirst, Map<String, RegisteredTest> testsByName, Map<String, Set<String>> tagsByName, boolean registrationClosed) {
            this.namesNewestFirst = namesNewestFirst;
            this.testsByName = testsByName;
            this.tagsByName = tagsByName;
            this.registrationClosed = registrationClosed;
        }

        Bundle with(RegisteredTest test) {
            List<String> names = new ArrayList<>(this.namesNewestFirst.size() + 1);
            names.add(test.getName());
            names.addAll(this.namesNewestFirst);

            Map<String, RegisteredTest> tests = new HashMap<>(this.testsByName);
            tests.put(test.getName(), test);

            Map<String, Set<String>> tags = this.tagsByName;
            if (!test.getTags().isEmpty()) {
                tags = new HashMap<>(this.tagsByName);
                tags.put(test.getName(), test.getTags());
                tags = Collections.unmodifiableMap(tags);
            }

            return new Bundle(Collections.unmodifiableList(names), Collections.unmodifiableMap(tests), tags, false);
        }

        Bundle closed() {
            return new Bundle(this.namesNewestFirst, this.testsByName, this.tagsByName, true);
        }
    }
}
