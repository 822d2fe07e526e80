package org.janelia.fuzzer.detection.parameters;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, finite set of values for one tunable detector parameter.
 *
 * Numeric ranges are computed as start + (index * step) using decimal arithmetic,
 * so repeated floating point addition never adds or drops a value at the range end.
 *
 * @param  <T>  value type.
 */
public class ParameterAxis<T> {

    private final String name;
    private final List<T> values;

    public ParameterAxis(final String name,
                         final List<T> values)
            throws IllegalArgumentException {
        if ((values == null) || values.isEmpty()) {
            throw new IllegalArgumentException("axis '" + name + "' must have at least one value");
        }
        this.name = name;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @SafeVarargs
    public static <T> ParameterAxis<T> ofValues(final String name,
                                                final T... values) {
        return new ParameterAxis<>(name, Arrays.asList(values));
    }

    public static ParameterAxis<Boolean> ofBooleans(final String name) {
        return ofValues(name, true, false);
    }

    /**
     * @return integer axis with values start, start + step, ... up to end.
     */
    public static ParameterAxis<Integer> ofIntegers(final String name,
                                                    final int start,
                                                    final int end,
                                                    final int step,
                                                    final boolean endInclusive)
            throws IllegalArgumentException {
        validateStep(name, step);
        final List<Integer> list = new ArrayList<>();
        for (int value = start; endInclusive ? value <= end : value < end; value += step) {
            list.add(value);
        }
        return new ParameterAxis<>(name, list);
    }

    /**
     * @return decimal axis with values start, start + step, ... up to end.
     */
    public static ParameterAxis<Double> ofDecimals(final String name,
                                                   final String start,
                                                   final String end,
                                                   final String step,
                                                   final boolean endInclusive)
            throws IllegalArgumentException {

        final BigDecimal startValue = new BigDecimal(start);
        final BigDecimal stepValue = new BigDecimal(step);
        if (stepValue.signum() <= 0) {
            throw new IllegalArgumentException("axis '" + name + "' step must be positive");
        }

        final BigDecimal span = new BigDecimal(end).subtract(startValue);
        final BigDecimal steps = span.divide(stepValue, 0, endInclusive ? RoundingMode.FLOOR : RoundingMode.CEILING);
        final int count = endInclusive ? steps.intValue() + 1 : steps.intValue();

        final List<Double> list = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            list.add(startValue.add(stepValue.multiply(BigDecimal.valueOf(i))).doubleValue());
        }
        return new ParameterAxis<>(name, list);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return values.size();
    }

    public T get(final int index) {
        return values.get(index);
    }

    public List<T> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return name + values;
    }

    private static void validateStep(final String name,
                                     final int step) {
        if (step <= 0) {
            throw new IllegalArgumentException("axis '" + name + "' step must be positive");
        }
    }
}
