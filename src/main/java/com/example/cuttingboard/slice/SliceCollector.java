package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.query.CubeQuery;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A Collector that aggregates a stream of records into a {@link Slice}.
 *
 * <p>The collector supports parallel streams: partial bins are merged
 * cell by cell through the {@link SliceAggregator} combiner. Records
 * that don't pass the filters of the query are skipped.
 *
 * <pre>{@code
 * Slice slice = records.parallelStream()
 *     .collect(SliceCollector.toSlice(query, cube));
 * }</pre>
 */
public class SliceCollector implements Collector<Object, Map<List<Object>, Map<String, Accumulator>>, Slice> {

    private final SliceAggregator aggregator;

    public SliceCollector(CubeQuery query, CubeDefinition cube) {
        this(new SliceAggregator(query, cube));
    }

    public SliceCollector(SliceAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public static SliceCollector toSlice(CubeQuery query, CubeDefinition cube) {
        return new SliceCollector(query, cube);
    }

    @Override
    public Supplier<Map<List<Object>, Map<String, Accumulator>>> supplier() {
        return aggregator.supplier();
    }

    @Override
    public BiConsumer<Map<List<Object>, Map<String, Accumulator>>, Object> accumulator() {
        return aggregator.accumulator();
    }

    @Override
    public BinaryOperator<Map<List<Object>, Map<String, Accumulator>>> combiner() {
        return aggregator.combiner();
    }

    @Override
    public Function<Map<List<Object>, Map<String, Accumulator>>, Slice> finisher() {
        return aggregator.finisher();
    }

    /**
     * Bins are keyed by value, so encounter order doesn't matter.
     */
    @Override
    public Set<Characteristics> characteristics() {
        return Set.of(Characteristics.UNORDERED);
    }
}
