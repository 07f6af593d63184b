package com.example.cuttingboard.reuse;

import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.predicate.PredicateCompiler;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.query.Filter;
import com.example.cuttingboard.slice.Slice;
import com.example.cuttingboard.slice.SliceFunctions;
import com.example.cuttingboard.slice.SliceTrees;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Builds a coarser slice out of the cells of a cached one.
 *
 * <p>The new axes must be a subset of the cached axes, in any order. The new
 * query may add filters, but only on cached axes, so that every cell of the
 * cached slice is either kept whole or dropped. Kept cells are regrouped on
 * the new axes and their accumulators merged.
 */
public class ManipulateSlice extends AbstractReuseStrategy {

    public static final String NAME = "manipulate";

    public ManipulateSlice() {
        super(NAME, 10);
    }

    @Override
    public boolean isCompatible(CubeQuery query, Slice cached) {
        CubeQuery old = cached.query();
        if (!old.axes().containsAll(query.axes())) {
            return noMatch("axes", cached);
        }
        if (!query.filterSet().containsAll(old.filterSet())) {
            return noMatch("filters not compatible", cached);
        }
        for (Filter filter : addedFilters(query, old)) {
            if (!old.axes().contains(filter.name())) {
                return noMatch("filter on non axis", cached);
            }
        }
        if (!coversValues(query, cached)) {
            return noMatch("values", cached);
        }
        return match(cached);
    }

    @Override
    public Slice createSlice(CubeQuery query, Slice cached) {
        List<String> oldAxes = cached.query().axes();
        int[] positions = query.axes().stream().mapToInt(oldAxes::indexOf).toArray();
        Optional<Predicate<List<Object>>> filter =
                PredicateCompiler.compileOnKeys(addedFilters(query, cached.query()), oldAxes);
        List<String> names = query.sliceValues();

        Map<List<Object>, Map<String, Accumulator>> bins = new HashMap<>();
        SliceTrees.forEachCell(cached.data(), cached.dim(), (key, cell) -> {
            if (filter.isPresent() && !filter.get().test(key)) {
                return;
            }
            List<Object> newKey = project(key, positions);
            Map<String, Accumulator> target = bins.get(newKey);
            if (target == null) {
                bins.put(newKey, SliceTrees.copyCell(cell, names));
            } else {
                SliceTrees.mergeInto(target, cell);
            }
        });

        SliceFunctions functions = SliceFunctions.of(query, cached.cube());
        return Slice.create(query, cached.cube(), SliceTrees.nest(bins, query.dim(), functions::zero));
    }

    private static Set<Filter> addedFilters(CubeQuery query, CubeQuery old) {
        Set<Filter> rv = new HashSet<>(query.filterSet());
        rv.removeAll(old.filterSet());
        return rv;
    }

    private static List<Object> project(List<Object> key, int[] positions) {
        Object[] rv = new Object[positions.length];
        for (int i = 0; i < positions.length; i++) {
            rv[i] = key.get(positions[i]);
        }
        return Collections.unmodifiableList(Arrays.asList(rv));
    }
}
