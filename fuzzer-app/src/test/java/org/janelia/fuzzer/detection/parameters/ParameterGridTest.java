package org.janelia.fuzzer.detection.parameters;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ParameterAxis} and {@link ParameterGrid} classes.
 */
public class ParameterGridTest {

    @Test
    public void testIntegerAxis() {

        final ParameterAxis<Integer> exclusive = ParameterAxis.ofIntegers("threshold", 2, 20, 2, false);
        Assert.assertEquals("invalid exclusive values",
                            Arrays.asList(2, 4, 6, 8, 10, 12, 14, 16, 18), exclusive.getValues());

        final ParameterAxis<Integer> inclusive = ParameterAxis.ofIntegers("octaves", 1, 6, 1, true);
        Assert.assertEquals("invalid inclusive size", 6, inclusive.size());
        Assert.assertEquals("invalid last value", 6, inclusive.get(5).intValue());
    }

    @Test
    public void testDecimalAxisHasNoDrift() {

        final ParameterAxis<Double> scaleFactors = ParameterAxis.ofDecimals("scaleFactor", "1.1", "1.4", "0.1", true);
        Assert.assertEquals("invalid values", Arrays.asList(1.1, 1.2, 1.3, 1.4), scaleFactors.getValues());

        final ParameterAxis<Double> contrast = ParameterAxis.ofDecimals("contrastThreshold", "0.01", "0.10", "0.01", true);
        Assert.assertEquals("invalid contrast size", 10, contrast.size());
        Assert.assertEquals("invalid last contrast", 0.1, contrast.get(9), 0.0);

        final ParameterAxis<Double> thresholds = ParameterAxis.ofDecimals("threshold", "0.001", "0.051", "0.005", false);
        Assert.assertEquals("invalid threshold size", 10, thresholds.size());
        Assert.assertEquals("invalid last threshold", 0.046, thresholds.get(9), 0.0);
    }

    @Test
    public void testInvalidAxes() {
        expectIllegalArgument(() -> ParameterAxis.ofIntegers("bad", 1, 5, 0, true));
        expectIllegalArgument(() -> ParameterAxis.ofDecimals("bad", "1", "2", "0", true));
        expectIllegalArgument(() -> new ParameterAxis<>("bad", Collections.emptyList()));
        expectIllegalArgument(() -> new ParameterGrid<>(Collections.emptyList(), i -> "x"));
    }

    @Test
    public void testNestedOrder() {

        final ParameterGrid<String> grid = buildGrid();

        Assert.assertEquals("invalid size", 6, grid.size());
        Assert.assertEquals("invalid axis names", Arrays.asList("a", "b"), grid.getAxisNames());
        Assert.assertEquals("outer axis should vary slowest",
                            Arrays.asList("0x", "0y", "0z", "1x", "1y", "1z"), grid.toList());
        Assert.assertEquals("invalid indexed element", "1y", grid.get(4));

        try {
            grid.get(6);
            Assert.fail("index past end should fail");
        } catch (final IndexOutOfBoundsException e) {
            Assert.assertTrue("message should include size", e.getMessage().contains("6"));
        }
    }

    @Test
    public void testDeterministicGeneration() {
        final List<String> first = buildGrid().toList();
        final List<String> second = buildGrid().toList();
        Assert.assertEquals("grids built from identical axes should match", first, second);
    }

    private static ParameterGrid<String> buildGrid() {
        final ParameterAxis<Integer> a = ParameterAxis.ofIntegers("a", 0, 1, 1, true);
        final ParameterAxis<String> b = ParameterAxis.ofValues("b", "x", "y", "z");
        return new ParameterGrid<>(Arrays.asList(a, b), i -> a.get(i[0]) + b.get(i[1]));
    }

    private static void expectIllegalArgument(final Runnable runnable) {
        try {
            runnable.run();
            Assert.fail("IllegalArgumentException should have been thrown");
        } catch (final IllegalArgumentException e) {
            Assert.assertNotNull("exception should have a message", e.getMessage());
        }
    }
}
