package com.example.cuttingboard.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sort order of the rows of a query result.
 *
 * @param descending {@code true} for decreasing values
 * @param name the value (or axis) to sort by
 * @param pivotValues the values of the pivoted axes identifying the column
 *        group to sort by; empty to sort by the row totals
 */
public record QueryOrder(
        boolean descending,
        String name,
        List<Object> pivotValues
) {
    public QueryOrder {
        pivotValues = pivotValues == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(pivotValues));
    }

    /**
     * Parses a name optionally prefixed by {@code -} for a descending order.
     */
    public static QueryOrder parse(String name, List<Object> pivotValues) {
        if (name.startsWith("-")) {
            return new QueryOrder(true, name.substring(1), pivotValues);
        }
        return new QueryOrder(false, name, pivotValues);
    }

    public boolean dependsOnPivot() {
        return !pivotValues.isEmpty();
    }
}
