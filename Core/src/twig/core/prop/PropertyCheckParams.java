package twig.core.prop;

import twig.core.exception.InvalidConfigurationException;
import twig.core.util.ObjectChecker;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the parameters passed to one property check with the defaults of the suite.
 */
public final class PropertyCheckParams {

    private PropertyCheckParams() {}

    /**
     * Returns the defaults with every value overridden by the parameter of the same kind, if one was passed.
     *
     * @param params The parameters passed to the check.
     * @param defaults The defaults.
     * @return the merged config.
     * @throws InvalidConfigurationException if more than one parameter of the same kind was passed.
     */
    public static PropertyCheckConfig merge(List<PropertyCheckConfigParam> params, PropertyCheckConfig defaults) {
        ObjectChecker.requireNonNull(params, "params");
        ObjectChecker.requireNonNull(defaults, "defaults");

        Map<PropertyCheckConfigParam.Kind, Integer> overrides = new EnumMap<>(PropertyCheckConfigParam.Kind.class);
        Map<PropertyCheckConfigParam.Kind, Integer> timesPassed = new EnumMap<>(PropertyCheckConfigParam.Kind.class);
        for (PropertyCheckConfigParam param : params) {
            ObjectChecker.requireNonNull(param, "param");
            overrides.put(param.getKind(), param.getValue());
            Integer count = timesPassed.get(param.getKind());
            timesPassed.put(param.getKind(), (count == null) ? 1 : count + 1);
        }

        // Checked in declaration order.
        for (PropertyCheckConfigParam.Kind kind : PropertyCheckConfigParam.Kind.values()) {
            Integer count = timesPassed.get(kind);
            if ((count != null) && (count > 1)) {
                throw new InvalidConfigurationException("can pass at most " + kind.getDisplayName() + " config parameters, but " + count + " were passed");
            }
        }

        return PropertyCheckConfig.newBuilder()
                .minSuccessful(valueOr(overrides, PropertyCheckConfigParam.Kind.MIN_SUCCESSFUL, defaults.getMinSuccessful()))
                .maxSkipped(valueOr(overrides, PropertyCheckConfigParam.Kind.MAX_SKIPPED, defaults.getMaxSkipped()))
                .minSize(valueOr(overrides, PropertyCheckConfigParam.Kind.MIN_SIZE, defaults.getMinSize()))
                .maxSize(valueOr(overrides, PropertyCheckConfigParam.Kind.MAX_SIZE, defaults.getMaxSize()))
                .workers(valueOr(overrides, PropertyCheckConfigParam.Kind.WORKERS, defaults.getWorkers()))
                .build();
    }

    public static PropertyCheckConfig merge(PropertyCheckConfig defaults, PropertyCheckConfigParam... params) {
        ObjectChecker.requireNonNull(params, "params");
        return merge(Arrays.asList(params), defaults);
    }

    private static int valueOr(Map<PropertyCheckConfigParam.Kind, Integer> overrides, PropertyCheckConfigParam.Kind kind, int fallback) {
        Integer value = overrides.get(kind);
        return (value == null) ? fallback : value;
    }
}
