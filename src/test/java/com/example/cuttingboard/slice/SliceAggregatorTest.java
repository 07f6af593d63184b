package com.example.cuttingboard.slice;

import com.example.cuttingboard.DataException;
import com.example.cuttingboard.Sales;
import com.example.cuttingboard.Sales.Sale;
import com.example.cuttingboard.cube.CubeDef;
import com.example.cuttingboard.cube.Label;
import com.example.cuttingboard.query.CubeQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SliceAggregator and SliceCollector - building slices from records.
 *
 * <h2>Slice layout</h2>
 * <p>A query grouping by month then item gives a two-level tree:</p>
 * <pre>
 *   month=1 -> item=apples -> {number: 180}
 *           -> item=pears  -> {number: 101}
 *   month=2 -> item=apples -> {number:  50}
 * </pre>
 */
class SliceAggregatorTest {

    private static final CubeQuery BY_MONTH_AND_ITEM = new CubeQuery()
            .addAxis("month")
            .addAxis("item")
            .addValue("number");

    private static Slice aggregate(CubeQuery query) {
        return new SliceAggregator(query, Sales.cube()).aggregate(Sales.RECORDS);
    }

    // =========================================================================
    // AGGREGATION
    // =========================================================================

    @Test
    @DisplayName("Should group by month then item and sum numbers")
    void shouldGroupAndSum() {
        // When
        Slice slice = aggregate(BY_MONTH_AND_ITEM);

        // Then
        assertThat(slice.dim()).isEqualTo(2);
        assertThat(slice.keys()).containsExactly(1, 2);
        assertThat(slice.get(1).keys()).containsExactly("apples", "pears");
        assertThat(slice.get(1).get("apples").value("number")).isEqualTo(180L);
        assertThat(slice.get(1).get("pears").value("number")).isEqualTo(101L);
        assertThat(slice.get(2).keys()).containsExactly("apples");
        assertThat(slice.get(2).get("apples").value("number")).isEqualTo(50L);
    }

    @Test
    @DisplayName("Should compute every value of the query in each cell")
    void shouldComputeAllValues() {
        CubeQuery query = new CubeQuery().addAxis("item").addValue("number").addValue("count").addValue("avg");

        Slice apples = aggregate(query).get("apples");

        assertThat(apples.value("number")).isEqualTo(230L);
        assertThat(apples.value("count")).isEqualTo(3L);
        assertThat((Double) apples.value("avg")).isEqualTo(230.0 / 3);
        assertThat(apples.record()).containsOnlyKeys("number", "count", "avg");
    }

    @Test
    @DisplayName("A query without axes gives a single cell over the filtered records")
    void zeroDimensionSlice() {
        Slice total = new SliceAggregator(new CubeQuery().addValue("number"), Sales.cube())
                .aggregateFiltered(Sales.RECORDS, r -> ((Sale) r).place().equals("italy"));

        assertThat(total.dim()).isZero();
        assertThat(total.value("number")).isEqualTo(251L);
    }

    @Test
    @DisplayName("Should skip records that don't pass the query filters")
    void shouldApplyQueryFilters() {
        // Given
        CubeQuery italian = BY_MONTH_AND_ITEM.addFilter("place", "italy");

        // When
        Slice sequential = aggregate(italian);
        Slice parallel = Sales.RECORDS.parallelStream().collect(SliceCollector.toSlice(italian, Sales.cube()));

        // Then
        for (Slice slice : List.of(sequential, parallel)) {
            assertThat(slice.query()).isEqualTo(italian);
            assertThat(slice.get(1).get("apples").value("number")).isEqualTo(100L);
            assertThat(slice.get(1).get("pears").value("number")).isEqualTo(101L);
            assertThat(slice.get(2).get("apples").value("number")).isEqualTo(50L);
        }
    }

    @Test
    @DisplayName("An empty dataset gives an empty slice, or a zero cell without axes")
    void emptyDataset() {
        Slice empty = new SliceAggregator(BY_MONTH_AND_ITEM, Sales.cube()).aggregate(List.of());
        Slice zero = new SliceAggregator(new CubeQuery().addValue("number").addValue("count"), Sales.cube())
                .aggregate(List.of());

        assertThat(empty.keys()).isEmpty();
        assertThat(zero.value("number")).isNull();
        assertThat(zero.value("count")).isEqualTo(0L);
    }

    @Test
    @DisplayName("Hidden values are not computed")
    void hiddenValuesSkipped() {
        CubeQuery query = BY_MONTH_AND_ITEM.addValue("count").hideValue("count");

        Slice slice = aggregate(query);

        assertThat(slice.get(2).get("apples").record()).containsOnlyKeys("number");
        assertThat(slice.recordValues()).containsExactly("number");
    }

    @Test
    @DisplayName("Undefined names fail before reading any record")
    void undefinedNames() {
        CubeQuery query = new CubeQuery().addAxis("color").addValue("number");

        assertThatThrownBy(() -> new SliceAggregator(query, Sales.cube()))
                .isInstanceOf(DataException.class)
                .hasMessageContaining("color");
    }

    // =========================================================================
    // NAVIGATION
    // =========================================================================

    @Test
    @DisplayName("Sub-slices share the identity and tree of their parent")
    void subSlicesAreViews() {
        Slice slice = aggregate(BY_MONTH_AND_ITEM);

        Slice january = slice.get(1);

        assertThat(january.id()).isEqualTo(slice.id());
        assertThat(january.dim()).isEqualTo(1);
        assertThat(january.axis().name()).isEqualTo("item");
        assertThat(slice.at(List.of(1, "pears")).value("number")).isEqualTo(101L);
    }

    @Test
    @DisplayName("Every slice gets its own identifier")
    void uniqueIds() {
        assertThat(aggregate(BY_MONTH_AND_ITEM).id())
                .startsWith("s-")
                .isNotEqualTo(aggregate(BY_MONTH_AND_ITEM).id());
    }

    @Test
    @DisplayName("Navigation errors")
    void navigationErrors() {
        Slice slice = aggregate(BY_MONTH_AND_ITEM);
        Slice cell = slice.get(2).get("apples");

        assertThatThrownBy(() -> slice.get(3)).isInstanceOf(NoSuchElementException.class);
        assertThatThrownBy(slice::record).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(cell::keys).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cell.value("avg")).isInstanceOf(NoSuchElementException.class);
        assertThat(slice.containsKey(3)).isFalse();
    }

    @Test
    @DisplayName("Keys follow the label order, reversed when the label says so")
    void reversedLabel() {
        CubeDef cube = Sales.cube().addLabel(Label.label("item").reversed());

        Slice slice = new SliceAggregator(new CubeQuery().addAxis("item").addValue("number"), cube)
                .aggregate(Sales.RECORDS);

        assertThat(slice.keys()).containsExactly("pears", "apples");
        assertThat(slice.entries()).extracting(Map.Entry::getKey).containsExactly("pears", "apples");
    }

    @Test
    @DisplayName("Null keys sort first")
    void nullKeysFirst() {
        List<Object> records = new ArrayList<>(Sales.RECORDS);
        records.add(Map.of("number", 7));
        CubeDef cube = new CubeDef()
                .addLabel(Label.label("item", r -> r instanceof Sale ? ((Sale) r).item() : null))
                .addMeasure(Label.measure("number"));

        Slice slice = new SliceAggregator(new CubeQuery().addAxis("item").addValue("number"), cube)
                .aggregate(records);

        assertThat(slice.keys()).containsExactly(null, "apples", "pears");
        assertThat(slice.get((Object) null).value("number")).isEqualTo(7L);
    }

    @Test
    @DisplayName("distinctKeys lists the combinations of some axes")
    void distinctKeys() {
        Slice slice = aggregate(BY_MONTH_AND_ITEM.addAxis("place"));

        assertThat(slice.distinctKeys(List.of("item"))).containsExactly(List.of("apples"), List.of("pears"));
        assertThat(slice.distinctKeys(List.of("place", "month"))).containsExactly(
                List.of("england", 1), List.of("italy", 1), List.of("italy", 2));
    }

    @Test
    @DisplayName("makeAcc gives fresh accumulators for the query values")
    void makeAcc() {
        Slice slice = aggregate(BY_MONTH_AND_ITEM.addValue("count"));

        assertThat(slice.makeAcc()).containsOnlyKeys("number", "count");
        assertThat(slice.makeAcc().get("count").get()).isEqualTo(0L);
        assertThat(slice.axisLabels()).extracting(Label::name).containsExactly("month", "item");
        assertThat(slice.valueLabels()).extracting(Label::name).containsExactly("number", "count");
    }

    // =========================================================================
    // PARALLEL AGGREGATION
    // =========================================================================

    @Test
    @DisplayName("A parallel stream gives the same slice as a sequential scan")
    void parallelCollector() {
        // Given
        List<Sale> many = new ArrayList<>();
        IntStream.range(0, 10_000).forEach(i -> many.add(new Sale(
                LocalDate.of(2010, 1 + i % 12, 1), i % 3 == 0 ? "apples" : "pears", "italy", i % 100)));
        CubeQuery query = new CubeQuery().addAxis("month").addAxis("item").addValue("number").addValue("count");

        // When
        Slice sequential = new SliceAggregator(query, Sales.cube()).aggregate(many);
        Slice parallel = many.parallelStream().collect(SliceCollector.toSlice(query, Sales.cube()));

        // Then
        assertThat(parallel.keys()).isEqualTo(sequential.keys());
        for (Object month : sequential.keys()) {
            for (Object item : sequential.get(month).keys()) {
                Slice expected = sequential.get(month).get(item);
                Slice actual = parallel.get(month).get(item);
                assertThat(actual.value("number")).isEqualTo(expected.value("number"));
                assertThat(actual.value("count")).isEqualTo(expected.value("count"));
            }
        }
    }

    @Test
    @DisplayName("The combiner merges the cells of partial bins")
    void combinerMergesCells() {
        SliceAggregator aggregator = new SliceAggregator(BY_MONTH_AND_ITEM, Sales.cube());
        var left = aggregator.supplier().get();
        var right = aggregator.supplier().get();
        aggregator.accumulator().accept(left, Sales.RECORDS.get(0));
        aggregator.accumulator().accept(right, Sales.RECORDS.get(2));
        aggregator.accumulator().accept(right, Sales.RECORDS.get(3));

        Slice slice = aggregator.finisher().apply(aggregator.combiner().apply(left, right));

        assertThat(slice.get(1).get("apples").value("number")).isEqualTo(180L);
        assertThat(slice.get(2).get("apples").value("number")).isEqualTo(50L);
    }
}
