package twig.core.prop;

/**
 * The settings a property check runs with.
 *
 * minSuccessful: the number of successful evaluations needed for the property to pass, strictly positive.
 * maxSkipped: the number of discarded evaluations tolerated before giving up, non-negative.
 * minSize: the smallest size of generated values, non-negative.
 * maxSize: the largest size of generated values, non-negative.
 * workers: the number of threads evaluating the property, strictly positive.
 */
public final class PropertyCheckConfig {
    public static final int DEFAULT_MIN_SUCCESSFUL = 100;
    public static final int DEFAULT_MAX_SKIPPED = 500;
    public static final int DEFAULT_MIN_SIZE = 0;
    public static final int DEFAULT_MAX_SIZE = 100;
    public static final int DEFAULT_WORKERS = 1;
    private final int minSuccessful;
    private final int maxSkipped;
    private final int minSize;
    private final int maxSize;
    private final int workers;

    private PropertyCheckConfig(int minSuccessful, int maxSkipped, int minSize, int maxSize, int workers) {
        if (minSuccessful <= 0) {
            throw new IllegalArgumentException("minSuccessful must be strictly positive but was: " + minSuccessful);
        }
        if (maxSkipped < 0) {
            throw new IllegalArgumentException("maxSkipped must be non-negative but was: " + maxSkipped);
        }
        if (minSize < 0) {
            throw new IllegalArgumentException("minSize must be non-negative but was: " + minSize);
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be non-negative but was: " + maxSize);
        }
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be strictly positive but was: " + workers);
        }
        this.minSuccessful = minSuccessful;
        this.maxSkipped = maxSkipped;
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.workers = workers;
    }

    /**
     * Returns a config holding every default value.
     */
    public static PropertyCheckConfig defaults() {
        return newBuilder().build();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public int getMinSuccessful() {
        return this.minSuccessful;
    }

    public int getMaxSkipped() {
        return this.maxSkipped;
    }

    public int getMinSize() {
        return this.minSize;
    }

    public int getMaxSize() {
        return this.maxSize;
    }

    public int getWorkers() {
        return this.workers;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PropertyCheckConfig)) {
            return false;
        }
        PropertyCheckConfig that = (PropertyCheckConfig) other;
        return this.minSuccessful == that.minSuccessful
                && this.maxSkipped == that.maxSkipped
                && this.minSize == that.minSize
                && this.maxSize == that.maxSize
                && this.workers == that.workers;
    }

    @Override
    public int hashCode() {
        int hash = this.minSuccessful;
        hash = 31 * hash + this.maxSkipped;
        hash = 31 * hash + this.minSize;
        hash = 31 * hash + this.maxSize;
        return 31 * hash + this.workers;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { minSuccessful: " + this.minSuccessful
                + ", maxSkipped: " + this.maxSkipped
                + ", minSize: " + this.minSize
                + ", maxSize: " + this.maxSize
                + ", workers: " + this.workers + " }";
    }

    /**
     * A builder of {@link PropertyCheckConfig}. Any value not set keeps its default, and each value may be set once.
     */
    public static final class Builder {
        private Integer minSuccessful = null;
        private Integer maxSkipped = null;
        private Integer minSize = null;
        private Integer maxSize = null;
        private Integer workers = null;

        private Builder() {}

        public Builder minSuccessful(int minSuccessful) {
            if (this.minSuccessful != null) {
                throw new IllegalStateException("minSuccessful is already set.");
            }
            this.minSuccessful = minSuccessful;
            return this;
        }

        public Builder maxSkipped(int maxSkipped) {
            if (this.maxSkipped != null) {
                throw new IllegalStateException("maxSkipped is already set.");
            }
            this.maxSkipped = maxSkipped;
            return this;
        }

        public Builder minSize(int minSize) {
            if (this.minSize != null) {
                throw new IllegalStateException("minSize is already set.");
            }
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (this.maxSize != null) {
                throw new IllegalStateException("maxSize is already set.");
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder workers(int workers) {
            if (this.workers != null) {
                throw new IllegalStateException("workers is already set.");
            }
            this.workers = workers;
            return this;
        }

        public PropertyCheckConfig build() {
            return new PropertyCheckConfig(
                    (this.minSuccessful == null) ? DEFAULT_MIN_SUCCESSFUL : this.minSuccessful,
                    (this.maxSkipped == null) ? DEFAULT_MAX_SKIPPED : this.maxSkipped,
                    (this.minSize == null) ? DEFAULT_MIN_SIZE : this.minSize,
                    (this.maxSize == null) ? DEFAULT_MAX_SIZE : this.maxSize,
                    (this.workers == null) ? DEFAULT_WORKERS : this.workers);
        }
    }
}
