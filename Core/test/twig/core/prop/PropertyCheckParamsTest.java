package twig.core.prop;

import org.junit.Assert;
import org.junit.Test;
import twig.core.exception.InvalidConfigurationException;
import twig.core.helper.AssertHelper;

import java.util.Arrays;
import java.util.Collections;

public class PropertyCheckParamsTest {
    private static final PropertyCheckConfig DEFAULTS = PropertyCheckConfig.newBuilder()
            .minSuccessful(9)
            .maxSkipped(99)
            .minSize(99)
            .maxSize(99)
            .workers(99)
            .build();

    @Test
    public void testPassedMinSuccessfulOverridesOnlyThatValue() {
        PropertyCheckConfig merged = PropertyCheckParams.merge(DEFAULTS, PropertyCheckConfigParam.minSuccessful(3));

        Assert.assertEquals(3, merged.getMinSuccessful());
        Assert.assertEquals(99, merged.getMaxSkipped());
        Assert.assertEquals(99, merged.getMinSize());
        Assert.assertEquals(99, merged.getMaxSize());
        Assert.assertEquals(99, merged.getWorkers());
    }

    @Test
    public void testDuplicateParamIsRejected() {
        InvalidConfigurationException e = AssertHelper.assertThrows(InvalidConfigurationException.class, () -> PropertyCheckParams.merge(DEFAULTS,
                PropertyCheckConfigParam.minSuccessful(33),
                PropertyCheckConfigParam.minSuccessful(34)));
        Assert.assertEquals("can pass at most MinSuccessful config parameters, but 2 were passed", e.getMessage());

        AssertHelper.assertThrows(InvalidConfigurationException.class, () -> PropertyCheckParams.merge(DEFAULTS,
                PropertyCheckConfigParam.workers(1),
                PropertyCheckConfigParam.maxSize(2),
                PropertyCheckConfigParam.workers(3)));
    }

    @Test
    public void testNoParamsKeepsDefaults() {
        Assert.assertEquals(DEFAULTS, PropertyCheckParams.merge(Collections.<PropertyCheckConfigParam>emptyList(), DEFAULTS));
    }

    @Test
    public void testAllParamsPassed() {
        PropertyCheckConfig merged = PropertyCheckParams.merge(Arrays.asList(
                PropertyCheckConfigParam.minSuccessful(3),
                PropertyCheckConfigParam.maxSkipped(33),
                PropertyCheckConfigParam.minSize(33),
                PropertyCheckConfigParam.maxSize(33),
                PropertyCheckConfigParam.workers(33)), DEFAULTS);

        Assert.assertEquals(PropertyCheckConfig.newBuilder().minSuccessful(3).maxSkipped(33).minSize(33).maxSize(33).workers(33).build(), merged);
    }

    @Test
    public void testDocumentedDefaults() {
        PropertyCheckConfig defaults = PropertyCheckConfig.defaults();
        Assert.assertEquals(100, defaults.getMinSuccessful());
        Assert.assertEquals(500, defaults.getMaxSkipped());
        Assert.assertEquals(0, defaults.getMinSize());
        Assert.assertEquals(100, defaults.getMaxSize());
        Assert.assertEquals(1, defaults.getWorkers());
    }

    @Test
    public void testParamRanges() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfigParam.minSuccessful(0));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfigParam.maxSkipped(-1));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfigParam.minSize(-1));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfigParam.maxSize(-1));
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfigParam.workers(0));
        Assert.assertEquals(0, PropertyCheckConfigParam.maxSkipped(0).getValue());
    }

    @Test
    public void testConfigValidationAndBuilder() {
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfig.newBuilder().workers(0).build());
        AssertHelper.assertThrows(IllegalArgumentException.class, () -> PropertyCheckConfig.newBuilder().minSize(-5).build());
        AssertHelper.assertThrows(IllegalStateException.class, () -> PropertyCheckConfig.newBuilder().maxSize(1).maxSize(2));
    }
}
