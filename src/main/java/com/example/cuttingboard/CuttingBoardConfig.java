package com.example.cuttingboard;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Settings of a cutting board, read from JSON.
 *
 * <pre>{@code
 * {
 *   "cacheCapacity": 20,
 *   "strategies": ["reuse", "drill", "manipulate"],
 *   "parallelAggregation": false
 * }
 * }</pre>
 *
 * @param cacheCapacity the maximum number of cached slices
 * @param strategies the names of the reuse strategies, in the order they are tried
 * @param parallelAggregation whether dataset scans run on a parallel stream
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CuttingBoardConfig(
        int cacheCapacity,
        List<String> strategies,
        boolean parallelAggregation
) {
    public static final String DEFAULT_RESOURCE = "cutting-board.json";
    public static final int DEFAULT_CACHE_CAPACITY = 20;
    public static final List<String> DEFAULT_STRATEGIES = List.of("reuse", "drill", "manipulate");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public CuttingBoardConfig {
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive: " + cacheCapacity);
        }
        strategies = List.copyOf(strategies);
    }

    @JsonCreator
    public CuttingBoardConfig(
            @JsonProperty("cacheCapacity") Integer cacheCapacity,
            @JsonProperty("strategies") List<String> strategies,
            @JsonProperty("parallelAggregation") Boolean parallelAggregation
    ) {
        this(cacheCapacity != null ? cacheCapacity.intValue() : DEFAULT_CACHE_CAPACITY,
                strategies != null ? strategies : DEFAULT_STRATEGIES,
                parallelAggregation != null && parallelAggregation);
    }

    public static CuttingBoardConfig defaults() {
        return new CuttingBoardConfig(DEFAULT_CACHE_CAPACITY, DEFAULT_STRATEGIES, false);
    }

    public CuttingBoardConfig withCacheCapacity(int capacity) {
        return new CuttingBoardConfig(capacity, strategies, parallelAggregation);
    }

    public CuttingBoardConfig withStrategies(List<String> names) {
        return new CuttingBoardConfig(cacheCapacity, names, parallelAggregation);
    }

    public CuttingBoardConfig withParallelAggregation(boolean parallel) {
        return new CuttingBoardConfig(cacheCapacity, strategies, parallel);
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if there is none.
     */
    public static CuttingBoardConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a configuration from a classpath resource, or the defaults if it doesn't exist.
     *
     * @throws CubeException if the resource can't be read or parsed
     */
    public static CuttingBoardConfig load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = CuttingBoardConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                return defaults();
            }
            return MAPPER.readValue(in, CuttingBoardConfig.class);
        } catch (IOException e) {
            throw new CubeException("invalid configuration " + resource + ": " + e.getMessage(), e);
        }
    }

    public static CuttingBoardConfig parse(String json) {
        try {
            return MAPPER.readValue(json, CuttingBoardConfig.class);
        } catch (IOException e) {
            throw new CubeException("invalid configuration: " + e.getMessage(), e);
        }
    }
}
