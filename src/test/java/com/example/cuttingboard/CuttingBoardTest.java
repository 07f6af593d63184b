package com.example.cuttingboard;

import com.example.cuttingboard.Sales.Sale;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.query.FilterOperator;
import com.example.cuttingboard.slice.Slice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for CuttingBoard - slicing a dataset through the slice cache.
 *
 * <h2>Cache behaviour</h2>
 * <ul>
 *   <li>the first query scans the dataset and caches its slice</li>
 *   <li>the same query again reuses the cached slice as it is</li>
 *   <li>fixing the value of the first axis descends into the cached slice</li>
 *   <li>a query on fewer axes regroups the cells of a finer slice</li>
 *   <li>past the capacity the least recently used slice is dropped</li>
 * </ul>
 */
class CuttingBoardTest {

    private static final CubeQuery BY_MONTH_AND_ITEM = new CubeQuery()
            .addAxis("month")
            .addAxis("item")
            .addValue("number");

    // =========================================================================
    // SLICING
    // =========================================================================

    @Test
    @DisplayName("Should slice the dataset by month and item")
    void shouldSlice() {
        // Given
        CuttingBoard board = Sales.board();

        // When
        Slice slice = board.slice(BY_MONTH_AND_ITEM);

        // Then
        assertThat(slice.get(1).get("apples").value("number")).isEqualTo(180L);
        assertThat(slice.get(1).get("pears").value("number")).isEqualTo(101L);
        assertThat(slice.get(2).get("apples").value("number")).isEqualTo(50L);
        assertThat(board.stats()).isEqualTo(new BoardStats(1, 0, 1, 0, 1));
        assertThat(board.cachedSlices()).containsExactly(slice);
    }

    @Test
    @DisplayName("Should apply the query filters before grouping")
    void shouldFilterBeforeGrouping() {
        CuttingBoard board = Sales.board();

        Slice slice = board.slice(new CubeQuery()
                .addAxis("item")
                .addValue("number")
                .addFilter("place", "england", FilterOperator.NE));

        assertThat(slice.keys()).containsExactly("apples", "pears");
        assertThat(slice.get("apples").value("number")).isEqualTo(150L);
        assertThat(slice.get("pears").value("number")).isEqualTo(101L);
    }

    @Test
    @DisplayName("Should return the records passing the filters")
    void shouldFilterRecords() {
        CuttingBoard board = Sales.board();

        List<Object> italian = board.filter(new CubeQuery().addFilter("place", "italy"));
        List<Object> all = board.filter(new CubeQuery());

        assertThat(italian).extracting(r -> ((Sale) r).number()).containsExactly(100, 101, 50);
        assertThat(all).hasSize(4);
    }

    @Test
    @DisplayName("Undefined names are reported as data errors")
    void undefinedNames() {
        CuttingBoard board = Sales.board();

        assertThatThrownBy(() -> board.slice(new CubeQuery().addAxis("color")))
                .isInstanceOf(DataException.class);
        assertThatThrownBy(() -> board.slice(new CubeQuery().addFilter("color", "red")))
                .isInstanceOf(DataException.class);
    }

    // =========================================================================
    // REUSE
    // =========================================================================

    @Test
    @DisplayName("The same query is answered from the cache without storing a copy")
    void exactReuse() {
        // Given
        CuttingBoard board = Sales.board();
        Slice first = board.slice(BY_MONTH_AND_ITEM);

        // When
        Slice second = board.slice(BY_MONTH_AND_ITEM);

        // Then
        assertThat(second).isNotSameAs(first);
        assertThat(second.sharesDataWith(first)).isTrue();
        assertThat(board.cachedSlices()).containsExactly(first);
        assertThat(board.stats()).isEqualTo(new BoardStats(2, 1, 1, 0, 1));
    }

    @Test
    @DisplayName("Drilling into the first axis doesn't scan the dataset")
    void drillDown() {
        // Given
        CuttingBoard board = Sales.board();
        Slice all = board.slice(BY_MONTH_AND_ITEM);

        // When
        Slice january = board.slice(new CubeQuery().addAxis("item").addValue("number").addFilter("month", 1));

        // Then
        assertThat(january.get("apples").value("number")).isEqualTo(180L);
        assertThat(board.stats().scans()).isEqualTo(1);
        assertThat(board.cachedSlices()).containsExactly(january, all);
    }

    @Test
    @DisplayName("A coarser query is computed from a finer cached slice")
    void coarsening() {
        // Given
        CuttingBoard board = Sales.board();
        board.slice(BY_MONTH_AND_ITEM.addAxis("place"));

        // When
        Slice byItem = board.slice(new CubeQuery().addAxis("item").addValue("number"));
        Slice total = board.slice(new CubeQuery().addValue("number").addFilter("place", "italy"));

        // Then
        assertThat(byItem.get("apples").value("number")).isEqualTo(230L);
        assertThat(total.value("number")).isEqualTo(251L);
        assertThat(board.stats().scans()).isEqualTo(1);
        assertThat(board.stats().hits()).isEqualTo(2);
    }

    @Test
    @DisplayName("A slice used for reuse becomes the most recent")
    void reusePromotes() {
        // Given
        CuttingBoard board = Sales.board();
        Slice byMonth = board.slice(new CubeQuery().addAxis("month").addValue("number"));
        Slice byPlace = board.slice(new CubeQuery().addAxis("place").addValue("number"));
        assertThat(board.cachedSlices()).containsExactly(byPlace, byMonth);

        // When
        board.slice(new CubeQuery().addAxis("month").addValue("number"));

        // Then
        assertThat(board.cachedSlices()).containsExactly(byMonth, byPlace);
    }

    @Test
    @DisplayName("The least recently used slice is evicted past the capacity")
    void eviction() {
        // Given
        CuttingBoard board = new CuttingBoard(Sales.cube(), Dataset.of(Sales.RECORDS),
                Sales.config().withCacheCapacity(2));
        Slice byPlace = board.slice(new CubeQuery().addAxis("place").addValue("number"));
        Slice byItem = board.slice(new CubeQuery().addAxis("item").addValue("number"));

        // When
        Slice byMonth = board.slice(new CubeQuery().addAxis("month").addValue("number"));
        board.slice(new CubeQuery().addAxis("place").addValue("number"));

        // Then
        assertThat(board.stats().evictions()).isEqualTo(2);
        assertThat(board.stats().scans()).isEqualTo(4);
        assertThat(board.cachedSlices()).hasSize(2).doesNotContain(byPlace, byItem).contains(byMonth);
    }

    @Test
    @DisplayName("Disabled strategies are not used")
    void strategiesFromConfig() {
        CuttingBoard board = new CuttingBoard(Sales.cube(), Dataset.of(Sales.RECORDS),
                Sales.config().withStrategies(List.of("reuse")));
        board.slice(BY_MONTH_AND_ITEM);

        board.slice(new CubeQuery().addAxis("item").addValue("number").addFilter("month", 1));

        assertThat(board.stats().scans()).isEqualTo(2);
    }

    @Test
    @DisplayName("Clearing the cache forces a new scan")
    void clearCache() {
        CuttingBoard board = Sales.board();
        board.slice(BY_MONTH_AND_ITEM);

        board.clearCache();
        board.slice(BY_MONTH_AND_ITEM);

        assertThat(board.cachedSlices()).hasSize(1);
        assertThat(board.stats().misses()).isEqualTo(2);
    }

    // =========================================================================
    // DATASET AND CONCURRENCY
    // =========================================================================

    @Test
    @DisplayName("A lazy dataset is read once")
    void lazyDatasetReadOnce() {
        AtomicInteger reads = new AtomicInteger();
        CuttingBoard board = new CuttingBoard(Sales.cube(), Dataset.lazy(() -> {
            reads.incrementAndGet();
            return Sales.RECORDS;
        }), Sales.config());

        board.slice(BY_MONTH_AND_ITEM);
        board.slice(new CubeQuery().addAxis("place").addValue("number"));
        board.filter(new CubeQuery().addFilter("item", "pears"));

        assertThat(reads).hasValue(1);
    }

    @Test
    @DisplayName("Parallel aggregation gives the same slices")
    void parallelAggregation() {
        CuttingBoard board = new CuttingBoard(Sales.cube(), Dataset.of(Sales.RECORDS),
                Sales.config().withParallelAggregation(true));

        Slice slice = board.slice(BY_MONTH_AND_ITEM);

        assertThat(slice.get(1).get("apples").value("number")).isEqualTo(180L);
        assertThat(slice.get(2).get("apples").value("number")).isEqualTo(50L);
    }

    @Test
    @DisplayName("Concurrent requests all get correct slices")
    void concurrentRequests() throws Exception {
        // Given
        CuttingBoard board = Sales.board();
        List<CubeQuery> queries = List.of(
                BY_MONTH_AND_ITEM,
                new CubeQuery().addAxis("item").addValue("number").addFilter("month", 1),
                new CubeQuery().addAxis("item").addValue("number"),
                new CubeQuery().addValue("number"));
        List<Callable<Object>> tasks = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            CubeQuery query = queries.get(i % queries.size());
            tasks.add(() -> {
                Slice slice = board.slice(query);
                return query.dim() == 0 ? slice.value("number") : slice.keys();
            });
        }

        // When
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<Object>> results;
        try {
            results = executor.invokeAll(tasks);
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }

        // Then
        for (int i = 0; i < results.size(); i++) {
            Object result = results.get(i).get();
            switch (i % queries.size()) {
                case 0 -> assertThat(result).isEqualTo(List.of(1, 2));
                case 1, 2 -> assertThat(result).isEqualTo(List.of("apples", "pears"));
                default -> assertThat(result).isEqualTo(331L);
            }
        }
        assertThat(board.stats().lookups()).isEqualTo(200);
        assertThat(board.cachedSlices().size()).isLessThanOrEqualTo(20);
    }
}
