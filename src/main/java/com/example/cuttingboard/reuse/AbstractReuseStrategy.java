package com.example.cuttingboard.reuse;

import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Set;

/**
 * Base class of the reuse strategies, with the checks they share.
 */
abstract class AbstractReuseStrategy implements SliceReuseStrategy {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final int cost;

    protected AbstractReuseStrategy(String name, int cost) {
        this.name = name;
        this.cost = cost;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int estimateCost(CubeQuery query, Slice cached) {
        return cost;
    }

    /**
     * Every value the new slice stores, hidden ones included, must be stored by the cached one.
     */
    protected static boolean coversValues(CubeQuery query, Slice cached) {
        Set<String> available = new HashSet<>(cached.query().sliceValues());
        return available.containsAll(query.sliceValues());
    }

    protected boolean noMatch(String reason, Slice cached) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} NOMATCH: {}: {} {}", name, reason, cached.id(), cached.query());
        }
        return false;
    }

    protected boolean match(Slice cached) {
        if (logger.isDebugEnabled()) {
            logger.debug("{} MATCH: {} {}", name, cached.id(), cached.query());
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
