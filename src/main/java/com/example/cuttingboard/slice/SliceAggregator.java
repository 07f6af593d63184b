package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.predicate.PredicateCompiler;
import com.example.cuttingboard.query.CubeQuery;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Aggregates dataset records into a {@link Slice} for one query.
 *
 * <p>Records are binned by their tuple of axis values; each bin holds one
 * accumulator per value of the query. The finisher nests the bins into a
 * tree one level per axis. Partial bins from separate passes are combined
 * by merging their accumulators cell by cell.
 *
 * <p>Records that don't pass the filters of the query are skipped.
 *
 * <pre>{@code
 * Slice slice = new SliceAggregator(query, cube).aggregate(records);
 * }</pre>
 */
public class SliceAggregator implements Aggregator<Object, Map<List<Object>, Map<String, Accumulator>>, Slice> {

    private final CubeQuery query;
    private final CubeDefinition cube;
    private final SliceFunctions functions;
    private final Predicate<Object> filter;

    /**
     * @throws com.example.cuttingboard.DataException if the query uses names the cube doesn't define
     * @throws com.example.cuttingboard.QueryException if a filter can't be compiled
     */
    public SliceAggregator(CubeQuery query, CubeDefinition cube) {
        this.query = query;
        this.cube = cube;
        this.functions = SliceFunctions.of(query, cube);
        this.filter = PredicateCompiler.compile(query.filters(), cube).orElse(null);
    }

    @Override
    public Supplier<Map<List<Object>, Map<String, Accumulator>>> supplier() {
        return HashMap::new;
    }

    @Override
    public BiConsumer<Map<List<Object>, Map<String, Accumulator>>, Object> accumulator() {
        return (bins, record) -> {
            if (filter != null && !filter.test(record)) {
                return;
            }
            Map<String, Accumulator> cell = bins.computeIfAbsent(functions.key(record), k -> functions.zero());
            functions.accumulate(cell, record);
        };
    }

    @Override
    public BinaryOperator<Map<List<Object>, Map<String, Accumulator>>> combiner() {
        return (left, right) -> {
            for (Map.Entry<List<Object>, Map<String, Accumulator>> e : right.entrySet()) {
                Map<String, Accumulator> target = left.get(e.getKey());
                if (target == null) {
                    left.put(e.getKey(), e.getValue());
                } else {
                    SliceTrees.mergeInto(target, e.getValue());
                }
            }
            return left;
        };
    }

    @Override
    public Function<Map<List<Object>, Map<String, Accumulator>>, Slice> finisher() {
        return bins -> Slice.create(query, cube, functions, SliceTrees.nest(bins, query.dim(), functions::zero));
    }
}
