package twig.core.util;

public final class ObjectChecker {

    public static void assertNonNull(Object object) {
        if (object == null) {
            throw new NullPointerException("object must be non-null.");
        }
    }

    public static void assertNonNull(Object... objects) {
        for (int i = 0; i < objects.length; i++) {
            if (objects[i] == null) {
                throw new NullPointerException("object must be non-null: violated by object at index " + i);
            }
        }
    }

    /**
     * Throws a {@link NullPointerException} naming the argument if it is null, otherwise returns it.
     */
    public static <T> T requireNonNull(T object, String name) {
        if (object == null) {
            throw new NullPointerException(name + " was null");
        }
        return object;
    }

    public static void assertPositive(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("value must be strictly positive but was: " + value);
        }
    }

    public static void assertNonNegative(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative but was: " + value);
        }
    }
}
