package twig.core.report;

import twig.core.util.ObjectChecker;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * A serializable reference to a suite, and optionally to a single test inside it, that an external runner can use to
 * rerun just that entity. The engine only creates and attaches these, it never interprets them.
 */
public final class Rerunner implements Serializable {
    private static final long serialVersionUID = 1L;
    private final String suiteClassName;
    private final String testName;

    private Rerunner(String suiteClassName, String testName) {
        this.suiteClassName = suiteClassName;
        this.testName = testName;
    }

    public static Rerunner forSuite(String suiteClassName) {
        ObjectChecker.assertNonNull(suiteClassName);
        return new Rerunner(suiteClassName, null);
    }

    public static Rerunner forTest(String suiteClassName, String testName) {
        ObjectChecker.assertNonNull(suiteClassName, testName);
        return new Rerunner(suiteClassName, testName);
    }

    public String getSuiteClassName() {
        return this.suiteClassName;
    }

    public Optional<String> getTestName() {
        return Optional.ofNullable(this.testName);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Rerunner)) {
            return false;
        }
        Rerunner that = (Rerunner) other;
        return this.suiteClassName.equals(that.suiteClassName) && Objects.equals(this.testName, that.testName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.suiteClassName, this.testName);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suite: " + this.suiteClassName + (this.testName == null ? "" : ", test: " + this.testName) + " }";
    }
}
