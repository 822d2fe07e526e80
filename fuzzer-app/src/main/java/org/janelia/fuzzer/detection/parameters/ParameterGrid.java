package org.janelia.fuzzer.detection.parameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Cartesian product of parameter axes, exposed as a lazily computed sequence.
 *
 * Combinations are produced in nested loop order: the first axis varies slowest and
 * the last axis varies fastest.  Element i is derived directly from i (mixed radix
 * decomposition), so iterating never holds more than one combination and two grids
 * built from the same axes always produce identical sequences.
 *
 * @param  <P>  type built for each combination.
 */
public class ParameterGrid<P>
        implements Iterable<P> {

    /**
     * Builds the element for one combination.
     * Index i of the array is the value index within axis i.
     */
    @FunctionalInterface
    public interface Combiner<P> {
        P combine(int[] axisIndexes);
    }

    private final List<ParameterAxis<?>> axes;
    private final Combiner<P> combiner;
    private final long size;

    public ParameterGrid(final List<? extends ParameterAxis<?>> axes,
                         final Combiner<P> combiner)
            throws IllegalArgumentException {

        if (axes.isEmpty()) {
            throw new IllegalArgumentException("grid must have at least one axis");
        }

        this.axes = Collections.unmodifiableList(new ArrayList<>(axes));
        this.combiner = combiner;

        long product = 1;
        for (final ParameterAxis<?> axis : axes) {
            product = Math.multiplyExact(product, axis.size());
        }
        this.size = product;
    }

    public long size() {
        return size;
    }

    public List<String> getAxisNames() {
        return axes.stream().map(ParameterAxis::getName).collect(Collectors.toList());
    }

    public P get(final long index)
            throws IndexOutOfBoundsException {

        if ((index < 0) || (index >= size)) {
            throw new IndexOutOfBoundsException("index " + index + " is outside grid of size " + size);
        }

        final int[] axisIndexes = new int[axes.size()];
        long remainder = index;
        for (int i = axes.size() - 1; i >= 0; i--) {
            final int axisSize = axes.get(i).size();
            axisIndexes[i] = (int) (remainder % axisSize);
            remainder = remainder / axisSize;
        }

        return combiner.combine(axisIndexes);
    }

    @Override
    public Iterator<P> iterator() {
        return new Iterator<P>() {

            private long nextIndex = 0;

            @Override
            public boolean hasNext() {
                return nextIndex < size;
            }

            @Override
            public P next() {
                if (! hasNext()) {
                    throw new NoSuchElementException();
                }
                final P element = get(nextIndex);
                nextIndex++;
                return element;
            }
        };
    }

    /**
     * Materializes the full grid.  Only use this for small grids.
     */
    public List<P> toList() {
        final List<P> list = new ArrayList<>((int) Math.min(size, Integer.MAX_VALUE));
        for (final P element : this) {
            list.add(element);
        }
        return list;
    }

    @Override
    public String toString() {
        return size + " combinations of " + getAxisNames();
    }
}
