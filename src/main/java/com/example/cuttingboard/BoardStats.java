package com.example.cuttingboard;

/**
 * A snapshot of the activity of a cutting board.
 *
 * @param lookups slice requests
 * @param hits requests answered from a cached slice
 * @param misses requests that required a scan of the dataset
 * @param evictions slices dropped from the cache
 * @param scans full scans of the dataset, for slices and filters alike
 */
public record BoardStats(long lookups, long hits, long misses, long evictions, long scans) {

    public double hitRatio() {
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
