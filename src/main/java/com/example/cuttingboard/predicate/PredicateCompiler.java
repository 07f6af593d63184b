package com.example.cuttingboard.predicate;

import com.example.cuttingboard.DataException;
import com.example.cuttingboard.QueryException;
import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.cube.Label;
import com.example.cuttingboard.query.Filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Compiles the filters of a query into a single predicate.
 *
 * <p>The filters are ANDed. An empty filter list compiles to
 * {@link Optional#empty()} rather than to an always-true predicate, so
 * callers can skip the filtering pass altogether.
 *
 * <p>Two forms are supported:
 * <ul>
 *   <li>{@link #compile(Collection, CubeDefinition)} tests raw records,
 *       extracting the filtered values through the cube labels</li>
 *   <li>{@link #compileOnKeys(Collection, List)} tests the key tuples of an
 *       already grouped slice, for filters on its axes</li>
 * </ul>
 */
public final class PredicateCompiler {

    private PredicateCompiler() {
    }

    /**
     * Compiles filters over raw records.
     *
     * @throws DataException if a filter names a label the cube doesn't define
     * @throws QueryException if a filter value is not usable with its operator
     */
    public static Optional<Predicate<Object>> compile(Collection<Filter> filters, CubeDefinition cube) {
        if (filters.isEmpty()) {
            return Optional.empty();
        }
        List<Predicate<Object>> tests = new ArrayList<>(filters.size());
        for (Filter f : filters) {
            Label label = cube.getLabel(f.name());
            Predicate<Object> test = OperatorTests.bind(f.operator(), f.value());
            tests.add(record -> test.test(label.extract(record)));
        }
        return Optional.of(allOf(tests));
    }

    /**
     * Compiles filters over the key tuples of a slice grouped by {@code axes}.
     *
     * @throws QueryException if a filter is not on one of the axes
     */
    public static Optional<Predicate<List<Object>>> compileOnKeys(Collection<Filter> filters, List<String> axes) {
        if (filters.isEmpty()) {
            return Optional.empty();
        }
        List<Predicate<List<Object>>> tests = new ArrayList<>(filters.size());
        for (Filter f : filters) {
            int idx = axes.indexOf(f.name());
            if (idx < 0) {
                throw new QueryException("filter on '" + f.name() + "' is not on an axis of " + axes);
            }
            Predicate<Object> test = OperatorTests.bind(f.operator(), f.value());
            tests.add(key -> test.test(key.get(idx)));
        }
        return Optional.of(allOf(tests));
    }

    private static <T> Predicate<T> allOf(List<Predicate<T>> tests) {
        return item -> {
            for (Predicate<T> test : tests) {
                if (!test.test(item)) {
                    return false;
                }
            }
            return true;
        };
    }
}
