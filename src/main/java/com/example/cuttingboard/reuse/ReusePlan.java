package com.example.cuttingboard.reuse;

import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;

/**
 * The chosen way of deriving the slice of a query from a cached slice.
 *
 * @param cost the estimated cost of the strategy
 * @param index the position of the source slice in the cache, most recent first
 * @param strategy the strategy to apply
 * @param source the cached slice to derive from
 */
public record ReusePlan(int cost, int index, SliceReuseStrategy strategy, Slice source) {

    public Slice execute(CubeQuery query) {
        return strategy.createSlice(query, source);
    }
}
