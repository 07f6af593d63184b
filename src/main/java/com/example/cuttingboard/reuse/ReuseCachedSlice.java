package com.example.cuttingboard.reuse;

import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;

/**
 * Reuses the slice of an equivalent query as it is.
 *
 * <p>The queries must have the same axes in the same order and the same
 * filters in any order; the cached slice may store more values. The new
 * slice shares the tree of the cached one.
 */
public class ReuseCachedSlice extends AbstractReuseStrategy {

    public static final String NAME = "reuse";

    public ReuseCachedSlice() {
        super(NAME, 1);
    }

    @Override
    public boolean isCompatible(CubeQuery query, Slice cached) {
        CubeQuery old = cached.query();
        if (!old.axes().equals(query.axes())) {
            return noMatch("axes", cached);
        }
        if (!old.filterSet().equals(query.filterSet())) {
            return noMatch("filters", cached);
        }
        if (!coversValues(query, cached)) {
            return noMatch("values", cached);
        }
        return match(cached);
    }

    @Override
    public Slice createSlice(CubeQuery query, Slice cached) {
        return Slice.create(query, cached.cube(), cached.data());
    }
}
