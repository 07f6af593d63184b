package com.example.cuttingboard;

import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.predicate.PredicateCompiler;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.reuse.ReusePlan;
import com.example.cuttingboard.reuse.SliceCache;
import com.example.cuttingboard.reuse.SliceReusePlanner;
import com.example.cuttingboard.slice.Slice;
import com.example.cuttingboard.slice.SliceAggregator;
import com.example.cuttingboard.slice.SliceCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Answers cube queries over a dataset, reusing the slices of previous queries.
 *
 * <p>A request first looks for a cached slice the new one can be derived
 * from (see {@link SliceReusePlanner}); only when there is none is the
 * dataset scanned. Every slice produced is cached, except those that share
 * the tree of the slice they were derived from.
 *
 * <pre>{@code
 * CuttingBoard board = new CuttingBoard(cube, Dataset.of(sales));
 * Slice byMonth = board.slice(new CubeQuery().addAxis("month").addValue("amount"));
 * Slice january = board.slice(new CubeQuery().addFilter("month", 1).addValue("amount"));  // no scan
 * }</pre>
 *
 * <p>The board is thread-safe. Cache lookups and updates are serialized;
 * scans and slice derivations run concurrently.
 */
public class CuttingBoard {

    private static final Logger logger = LoggerFactory.getLogger(CuttingBoard.class);

    private final CubeDefinition cube;
    private final Dataset dataset;
    private final CuttingBoardConfig config;
    private final SliceReusePlanner planner;
    private final SliceCache cache;
    private final ReentrantLock lock = new ReentrantLock();

    private final AtomicLong lookups = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();
    private final AtomicLong scans = new AtomicLong();

    /**
     * Creates a board configured from the {@value CuttingBoardConfig#DEFAULT_RESOURCE} classpath resource.
     */
    public CuttingBoard(CubeDefinition cube, Dataset dataset) {
        this(cube, dataset, CuttingBoardConfig.load());
    }

    public CuttingBoard(CubeDefinition cube, Dataset dataset, CuttingBoardConfig config) {
        this.cube = cube;
        this.dataset = dataset;
        this.config = config;
        this.planner = SliceReusePlanner.withStrategies(config.strategies());
        this.cache = new SliceCache(config.cacheCapacity());
        logger.info("Created cutting board with cache capacity {} and strategies {}",
                config.cacheCapacity(), config.strategies());
    }

    public static CuttingBoard of(CubeDefinition cube, List<?> records) {
        return new CuttingBoard(cube, Dataset.of(records));
    }

    public CubeDefinition cube() {
        return cube;
    }

    public Dataset dataset() {
        return dataset;
    }

    public CuttingBoardConfig config() {
        return config;
    }

    /**
     * Returns the slice of a query, from the cache when possible.
     *
     * @throws DataException if the query uses names the cube doesn't define
     * @throws QueryException if a filter can't be compiled
     */
    public Slice slice(CubeQuery query) {
        lookups.incrementAndGet();
        logger.debug("LOOKUP: {}", query);

        Optional<Slice> cached = lookup(query);
        if (cached.isPresent()) {
            return cached.get();
        }

        Slice slice = makeSlice(query);
        logger.debug("NEW: slice {} for query {}", slice.id(), query);
        store(slice);
        return slice;
    }

    /**
     * Returns the records of the dataset that pass the filters of the query.
     */
    public List<Object> filter(CubeQuery query) {
        Optional<Predicate<Object>> predicate = PredicateCompiler.compile(query.filters(), cube);
        List<Object> records = dataset.records();
        scans.incrementAndGet();
        if (predicate.isEmpty()) {
            return records;
        }
        List<Object> rv = new ArrayList<>();
        for (Object record : records) {
            if (predicate.get().test(record)) {
                rv.add(record);
            }
        }
        return Collections.unmodifiableList(rv);
    }

    public BoardStats stats() {
        return new BoardStats(lookups.get(), hits.get(), misses.get(), evictions.get(), scans.get());
    }

    /**
     * The cached slices, most recently used first.
     */
    public List<Slice> cachedSlices() {
        lock.lock();
        try {
            return cache.slices();
        } finally {
            lock.unlock();
        }
    }

    public void clearCache() {
        lock.lock();
        try {
            cache.clear();
        } finally {
            lock.unlock();
        }
        logger.debug("cache cleared");
    }

    private Optional<Slice> lookup(CubeQuery query) {
        ReusePlan plan;
        lock.lock();
        try {
            plan = planner.plan(query, cache.slices()).orElse(null);
            if (plan == null) {
                misses.incrementAndGet();
                logger.debug("MISS: {}", query);
                return Optional.empty();
            }
            cache.promote(plan.index());
        } finally {
            lock.unlock();
        }

        Slice slice = plan.execute(query);
        hits.incrementAndGet();
        logger.debug("HIT: new slice {} from slice {} using {}",
                slice.id(), plan.source().id(), plan.strategy().name());
        if (!slice.sharesDataWith(plan.source())) {
            store(slice);
        }
        return Optional.of(slice);
    }

    private Slice makeSlice(CubeQuery query) {
        SliceAggregator aggregator = new SliceAggregator(query, cube);
        List<Object> records = dataset.records();
        scans.incrementAndGet();

        if (config.parallelAggregation()) {
            return records.parallelStream().collect(new SliceCollector(aggregator));
        }
        return aggregator.aggregate(records);
    }

    private void store(Slice slice) {
        Optional<Slice> evicted;
        lock.lock();
        try {
            evicted = cache.insert(slice);
        } finally {
            lock.unlock();
        }
        if (evicted.isPresent()) {
            evictions.incrementAndGet();
            logger.debug("PURGED: slice {}", evicted.get().id());
        }
    }
}
