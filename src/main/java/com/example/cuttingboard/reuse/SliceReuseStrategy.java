package com.example.cuttingboard.reuse;

import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;

/**
 * A way of deriving the slice of a query from a slice already computed.
 *
 * <p>Strategies are stateless: the same instance is asked about every
 * query and every cached slice.
 */
public interface SliceReuseStrategy {

    /**
     * The name used to enable the strategy in the configuration.
     */
    String name();

    /**
     * Returns {@code true} if the slice of {@code query} can be derived from {@code cached}.
     */
    boolean isCompatible(CubeQuery query, Slice cached);

    /**
     * The relative cost of deriving the slice; 1 is the cheapest possible.
     * Only called on compatible slices.
     */
    int estimateCost(CubeQuery query, Slice cached);

    /**
     * Derives the slice of {@code query} from a compatible cached slice.
     * The cached slice is never modified.
     */
    Slice createSlice(CubeQuery query, Slice cached);
}
