package twig.core.config;

import twig.core.suite.TagFilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Describes one run: which suites to execute, optionally a single test, the include and exclude tags, the number of
 * worker threads and the configuration map handed to every suite.
 */
public final class RunConfiguration {
    public static final int DEFAULT_NUM_THREADS = 1;
    private final List<String> suiteClassNames;
    private final Optional<String> testName;
    private final Set<String> includeTags;
    private final Set<String> excludeTags;
    private final int numThreads;
    private final Map<String, Object> configMap;

    private RunConfiguration(List<String> suiteClassNames, Optional<String> testName, Set<String> includeTags, Set<String> excludeTags, int numThreads, Map<String, Object> configMap) {
        this.suiteClassNames = Collections.unmodifiableList(new ArrayList<>(suiteClassNames));
        this.testName = testName;
        this.includeTags = Collections.unmodifiableSet(new LinkedHashSet<>(includeTags));
        this.excludeTags = Collections.unmodifiableSet(new LinkedHashSet<>(excludeTags));
        this.numThreads = numThreads;
        this.configMap = Collections.unmodifiableMap(new LinkedHashMap<>(configMap));
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Returns a copy of this configuration that runs with the given number of threads.
     *
     * @param numThreads The number of worker threads, strictly positive.
     * @return the new configuration.
     */
    public RunConfiguration withNumThreads(int numThreads) {
        if (numThreads <= 0) {
            throw new IllegalArgumentException("numThreads must be strictly positive but was: " + numThreads);
        }
        return new RunConfiguration(this.suiteClassNames, this.testName, this.includeTags, this.excludeTags, numThreads, this.configMap);
    }

    public List<String> getSuiteClassNames() {
        return this.suiteClassNames;
    }

    public Optional<String> getTestName() {
        return this.testName;
    }

    public Set<String> getIncludeTags() {
        return this.includeTags;
    }

    public Set<String> getExcludeTags() {
        return this.excludeTags;
    }

    public int getNumThreads() {
        return this.numThreads;
    }

    public Map<String, Object> getConfigMap() {
        return this.configMap;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { suites: " + this.suiteClassNames
                + ", " + (this.testName.isPresent() ? "test: " + this.testName.get() : "all tests")
                + ", include: " + this.includeTags
                + ", exclude: " + this.excludeTags
                + ", threads: " + this.numThreads + " }";
    }

    /**
     * A builder of {@link RunConfiguration}. Each value may be set once.
     *
     * At least one suite is required. A test name may only be given together with exactly one suite. When no exclude
     * tags are given, ignored tests are excluded.
     */
    public static final class Builder {
        private List<String> suiteClassNames = null;
        private String testName = null;
        private Set<String> includeTags = null;
        private Set<String> excludeTags = null;
        private Integer numThreads = null;
        private Map<String, Object> configMap = null;

        private Builder() {}

        public Builder suiteClassNames(List<String> suiteClassNames) {
            if (suiteClassNames == null) {
                throw new NullPointerException("suiteClassNames was null");
            }
            if (this.suiteClassNames != null) {
                throw new IllegalStateException("suiteClassNames is already set.");
            }
            this.suiteClassNames = suiteClassNames;
            return this;
        }

        public Builder testName(String testName) {
            if (testName == null) {
                throw new NullPointerException("testName was null");
            }
            if (this.testName != null) {
                throw new IllegalStateException("testName is already set.");
            }
            this.testName = testName;
            return this;
        }

        public Builder includeTags(Set<String> includeTags) {
            if (includeTags == null) {
                throw new NullPointerException("includeTags was null");
            }
            if (this.includeTags != null) {
                throw new IllegalStateException("includeTags is already set.");
            }
            this.includeTags = includeTags;
            return this;
        }

        public Builder excludeTags(Set<String> excludeTags) {
            if (excludeTags == null) {
                throw new NullPointerException("excludeTags was null");
            }
            if (this.excludeTags != null) {
                throw new IllegalStateException("excludeTags is already set.");
            }
            this.excludeTags = excludeTags;
            return this;
        }

        public Builder numThreads(int numThreads) {
            if (numThreads <= 0) {
                throw new IllegalArgumentException("numThreads must be strictly positive but was: " + numThreads);
            }
            if (this.numThreads != null) {
                throw new IllegalStateException("numThreads is already set.");
            }
            this.numThreads = numThreads;
            return this;
        }

        public Builder configMap(Map<String, Object> configMap) {
            if (configMap == null) {
                throw new NullPointerException("configMap was null");
            }
            if (this.configMap != null) {
                throw new IllegalStateException("configMap is already set.");
            }
            this.configMap = configMap;
            return this;
        }

        public RunConfiguration build() {
            if ((this.suiteClassNames == null) || this.suiteClassNames.isEmpty()) {
                throw new IllegalStateException("At least one suite class name must be given.");
            }
            if ((this.testName != null) && (this.suiteClassNames.size() != 1)) {
                throw new IllegalStateException("A test name can only be given together with exactly one suite but " + this.suiteClassNames.size() + " suites were given.");
            }
            return new RunConfiguration(
                    this.suiteClassNames,
                    Optional.ofNullable(this.testName),
                    (this.includeTags == null) ? Collections.<String>emptySet() : this.includeTags,
                    (this.excludeTags == null) ? Collections.singleton(TagFilter.IGNORE_TAG) : this.excludeTags,
                    (this.numThreads == null) ? DEFAULT_NUM_THREADS : this.numThreads,
                    (this.configMap == null) ? Collections.<String, Object>emptyMap() : this.configMap);
        }
    }
}
