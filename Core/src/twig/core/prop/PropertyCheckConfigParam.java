package twig.core.prop;

/**
 * A single override of one {@link PropertyCheckConfig} value, passed to one property check.
 */
public final class PropertyCheckConfigParam {
    private final Kind kind;
    private final int value;

    /**
     * The config value a parameter overrides. The display name is the one used in error messages.
     */
    public enum Kind {
        MIN_SUCCESSFUL("MinSuccessful"),
        MAX_SKIPPED("MaxSkipped"),
        MIN_SIZE("MinSize"),
        MAX_SIZE("MaxSize"),
        WORKERS("Workers");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return this.displayName;
        }
    }

    private PropertyCheckConfigParam(Kind kind, int value) {
        this.kind = kind;
        this.value = value;
    }

    public static PropertyCheckConfigParam minSuccessful(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("MinSuccessful must be strictly positive but was: " + value);
        }
        return new PropertyCheckConfigParam(Kind.MIN_SUCCESSFUL, value);
    }

    public static PropertyCheckConfigParam maxSkipped(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("MaxSkipped must be non-negative but was: " + value);
        }
        return new PropertyCheckConfigParam(Kind.MAX_SKIPPED, value);
    }

    public static PropertyCheckConfigParam minSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("MinSize must be non-negative but was: " + value);
        }
        return new PropertyCheckConfigParam(Kind.MIN_SIZE, value);
    }

    public static PropertyCheckConfigParam maxSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("MaxSize must be non-negative but was: " + value);
        }
        return new PropertyCheckConfigParam(Kind.MAX_SIZE, value);
    }

    public static PropertyCheckConfigParam workers(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Workers must be strictly positive but was: " + value);
        }
        return new PropertyCheckConfigParam(Kind.WORKERS, value);
    }

    public Kind getKind() {
        return this.kind;
    }

    public int getValue() {
        return this.value;
    }

    @Override
    public String toString() {
        return this.kind.getDisplayName() + "(" + this.value + ")";
    }
}
