package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.cube.Label;
import com.example.cuttingboard.query.CubeQuery;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The result of aggregating a dataset for a {@link CubeQuery}.
 *
 * <p>A slice of dimension {@code n} is a tree of depth {@code n}: its keys
 * are the values of the next axis, and {@link #get(Object)} returns the
 * sub-slice of dimension {@code n - 1} for one of them. A slice of dimension
 * 0 is a single cell, read through {@link #record()} and {@link #value(String)}.
 *
 * <p>Slices are read-only. Sub-slices and slices derived through reuse may
 * share their tree with the slice they came from.
 */
public final class Slice {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final CubeQuery query;
    private final CubeDefinition cube;
    private final SliceFunctions functions;
    private final SliceNode data;
    private final int dim;

    private Slice(String id, CubeQuery query, CubeDefinition cube, SliceFunctions functions, SliceNode data, int dim) {
        this.id = id;
        this.query = query;
        this.cube = cube;
        this.functions = functions;
        this.data = data;
        this.dim = dim;
    }

    /**
     * Creates a top-level slice for a query over an existing tree.
     *
     * @throws IllegalArgumentException if the tree doesn't match the dimension of the query
     */
    public static Slice create(CubeQuery query, CubeDefinition cube, SliceNode data) {
        return create(query, cube, SliceFunctions.of(query, cube), data);
    }

    static Slice create(CubeQuery query, CubeDefinition cube, SliceFunctions functions, SliceNode data) {
        Objects.requireNonNull(data, "data");
        boolean leaf = data instanceof SliceNode.Leaf;
        if (leaf != (query.dim() == 0)) {
            throw new IllegalArgumentException(
                    "a " + query.dim() + "-dimension slice can't have a " + (leaf ? "leaf" : "branch") + " root");
        }
        return new Slice("s-" + SEQUENCE.incrementAndGet(), query, cube, functions, data, query.dim());
    }

    public String id() {
        return id;
    }

    public CubeQuery query() {
        return query;
    }

    public CubeDefinition cube() {
        return cube;
    }

    /**
     * The number of levels below this slice.
     */
    public int dim() {
        return dim;
    }

    public SliceNode data() {
        return data;
    }

    /**
     * Returns {@code true} if both slices are views over the same tree.
     */
    public boolean sharesDataWith(Slice other) {
        return data == other.data;
    }

    // -- navigation ------------------------------------------------------------

    /**
     * The label of the axis this slice is keyed on.
     */
    public Label axis() {
        requireBranch();
        return functions.axisLabels().get(query.dim() - dim);
    }

    /**
     * The keys of this slice, sorted by the order of its axis label.
     */
    public List<Object> keys() {
        List<Object> keys = new ArrayList<>(branch().children().keySet());
        keys.sort(axis().comparator());
        return keys;
    }

    /**
     * The sub-slices of this slice, sorted like {@link #keys()}.
     */
    public List<Map.Entry<Object, Slice>> entries() {
        List<Map.Entry<Object, Slice>> rv = new ArrayList<>();
        for (Object key : keys()) {
            rv.add(new AbstractMap.SimpleImmutableEntry<>(key, get(key)));
        }
        return rv;
    }

    public boolean containsKey(Object key) {
        return branch().children().containsKey(key);
    }

    public int size() {
        return dim == 0 ? 1 : branch().children().size();
    }

    /**
     * Returns the sub-slice for one value of the axis.
     *
     * @throws NoSuchElementException if no record had that value
     */
    public Slice get(Object key) {
        SliceNode child = branch().children().get(key);
        if (child == null) {
            throw new NoSuchElementException("no key " + key + " on axis '" + axis().name() + "'");
        }
        return new Slice(id, query, cube, functions, child, dim - 1);
    }

    /**
     * Returns the sub-slice at the end of a path of keys, one per level.
     */
    public Slice at(List<?> path) {
        Slice rv = this;
        for (Object key : path) {
            rv = rv.get(key);
        }
        return rv;
    }

    /**
     * The accumulators of a 0-dimension slice, by value name.
     *
     * <p>A slice sharing the cells of a slice that computes more values only
     * exposes the values of its own query.
     */
    public Map<String, Accumulator> record() {
        if (dim != 0) {
            throw new IllegalStateException("slice " + id + " still has " + dim + " dimension(s)");
        }
        Map<String, Accumulator> cell = ((SliceNode.Leaf) data).accumulators();
        List<String> names = query.sliceValues();
        if (cell.size() == names.size()) {
            return cell;
        }
        Map<String, Accumulator> rv = new LinkedHashMap<>();
        for (String name : names) {
            rv.put(name, cell.get(name));
        }
        return Collections.unmodifiableMap(rv);
    }

    /**
     * The current value of one accumulator of a 0-dimension slice.
     *
     * @throws NoSuchElementException if the query doesn't compute that value
     */
    public Object value(String name) {
        Accumulator acc = query.sliceValues().contains(name) ? record().get(name) : null;
        if (acc == null) {
            throw new NoSuchElementException("value '" + name + "' is not computed by slice " + id);
        }
        return acc.get();
    }

    /**
     * Returns fresh accumulators for every value of the query.
     */
    public Map<String, Accumulator> makeAcc() {
        return functions.zero();
    }

    /**
     * The names of the values stored in every record, hidden ones included.
     */
    public List<String> recordValues() {
        return query.sliceValues();
    }

    public List<Label> axisLabels() {
        return functions.axisLabels();
    }

    public List<Label> valueLabels() {
        return functions.valueLabels();
    }

    /**
     * Returns the distinct combinations of values taken by some axes of this
     * slice, each combination in the order of {@code axes}, sorted level by level.
     *
     * @throws IllegalArgumentException if an axis is not below this slice
     */
    public List<List<Object>> distinctKeys(List<String> axes) {
        List<String> remaining = query.axes().subList(query.dim() - dim, query.dim());
        int[] positions = new int[axes.size()];
        List<Comparator<Object>> comparators = new ArrayList<>();
        for (int i = 0; i < positions.length; i++) {
            positions[i] = remaining.indexOf(axes.get(i));
            if (positions[i] < 0) {
                throw new IllegalArgumentException("axis '" + axes.get(i) + "' is not below slice " + id);
            }
            comparators.add(functions.axisLabels().get(query.dim() - dim + positions[i]).comparator());
        }

        Set<List<Object>> distinct = new HashSet<>();
        SliceTrees.forEachCell(data, dim, (key, cell) -> {
            Object[] projected = new Object[positions.length];
            for (int i = 0; i < positions.length; i++) {
                projected[i] = key.get(positions[i]);
            }
            distinct.add(Arrays.asList(projected));
        });

        List<List<Object>> rv = new ArrayList<>(distinct);
        rv.sort((a, b) -> {
            for (int i = 0; i < comparators.size(); i++) {
                int c = comparators.get(i).compare(a.get(i), b.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return 0;
        });
        return Collections.unmodifiableList(rv);
    }

    private SliceNode.Branch branch() {
        requireBranch();
        return (SliceNode.Branch) data;
    }

    private void requireBranch() {
        if (dim == 0) {
            throw new IllegalStateException("slice " + id + " has no dimension left");
        }
    }

    @Override
    public String toString() {
        return "Slice(" + id + ", dim=" + dim + ", " + query + ")";
    }
}
