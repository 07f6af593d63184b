package com.example.cuttingboard.reuse;

import com.example.cuttingboard.accumulator.Numbers;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.query.Filter;
import com.example.cuttingboard.query.FilterOperator;
import com.example.cuttingboard.slice.Slice;
import com.example.cuttingboard.slice.SliceFunctions;
import com.example.cuttingboard.slice.SliceNode;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Descends one level into a cached slice when the new query fixes the value
 * of its first axis.
 *
 * <p>The new query must have all the filters of the cached one plus a single
 * {@code eq} filter on the first cached axis, and the remaining cached axes.
 * A value that no record had yields an empty slice.
 */
public class DrillOnFirstAxis extends AbstractReuseStrategy {

    public static final String NAME = "drill";

    public DrillOnFirstAxis() {
        super(NAME, 1);
    }

    @Override
    public boolean isCompatible(CubeQuery query, Slice cached) {
        CubeQuery old = cached.query();
        if (old.filterSet().size() + 1 != query.filterSet().size()
                || !query.filterSet().containsAll(old.filterSet())) {
            return noMatch("number of filters", cached);
        }

        Filter added = addedFilter(query, old);
        List<String> oldAxes = old.axes();
        if (oldAxes.isEmpty() || !oldAxes.get(0).equals(added.name()) || added.operator() != FilterOperator.EQ) {
            return noMatch("new filter not on first axis", cached);
        }
        if (!oldAxes.subList(1, oldAxes.size()).equals(query.axes())) {
            return noMatch("axes", cached);
        }
        if (!coversValues(query, cached)) {
            return noMatch("values", cached);
        }
        return match(cached);
    }

    @Override
    public Slice createSlice(CubeQuery query, Slice cached) {
        Filter added = addedFilter(query, cached.query());
        Map<Object, SliceNode> children = ((SliceNode.Branch) cached.data()).children();

        SliceNode data = lookup(children, added.value());
        if (data == null) {
            data = query.dim() == 0
                    ? new SliceNode.Leaf(SliceFunctions.of(query, cached.cube()).zero())
                    : new SliceNode.Branch(Map.of());
        }
        return Slice.create(query, cached.cube(), data);
    }

    private static Filter addedFilter(CubeQuery query, CubeQuery old) {
        Set<Filter> added = new HashSet<>(query.filterSet());
        added.removeAll(old.filterSet());
        return added.iterator().next();
    }

    /**
     * Finds the child for a filter value; a numeric value also matches a key
     * of another numeric type, the way the {@code eq} operator does.
     */
    private static SliceNode lookup(Map<Object, SliceNode> children, Object value) {
        SliceNode rv = children.get(value);
        if (rv != null || !(value instanceof Number)) {
            return rv;
        }
        for (Map.Entry<Object, SliceNode> e : children.entrySet()) {
            if (e.getKey() instanceof Number && Numbers.compare(e.getKey(), value) == 0) {
                return e.getValue();
            }
        }
        return null;
    }
}
