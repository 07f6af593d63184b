package com.example.cuttingboard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CuttingBoardConfig - reading board settings from JSON.
 */
class CuttingBoardConfigTest {

    @Test
    @DisplayName("The bundled configuration holds the defaults")
    void bundledDefaults() {
        CuttingBoardConfig config = CuttingBoardConfig.load();

        assertThat(config).isEqualTo(CuttingBoardConfig.defaults());
        assertThat(config.cacheCapacity()).isEqualTo(20);
        assertThat(config.strategies()).containsExactly("reuse", "drill", "manipulate");
        assertThat(config.parallelAggregation()).isFalse();
    }

    @Test
    @DisplayName("Should load a configuration from the classpath")
    void loadResource() {
        CuttingBoardConfig config = CuttingBoardConfig.load("cutting-board-small.json");

        assertThat(config.cacheCapacity()).isEqualTo(2);
        assertThat(config.strategies()).containsExactly("reuse", "manipulate");
        assertThat(config.parallelAggregation()).isFalse();
    }

    @Test
    @DisplayName("A missing resource gives the defaults")
    void missingResource() {
        assertThat(CuttingBoardConfig.load("no-such-config.json")).isEqualTo(CuttingBoardConfig.defaults());
    }

    @Test
    @DisplayName("Missing properties take their default value; unknown ones are ignored")
    void partialJson() {
        CuttingBoardConfig config = CuttingBoardConfig.parse("{\"parallelAggregation\": true, \"colour\": \"red\"}");

        assertThat(config.cacheCapacity()).isEqualTo(20);
        assertThat(config.strategies()).isEqualTo(CuttingBoardConfig.DEFAULT_STRATEGIES);
        assertThat(config.parallelAggregation()).isTrue();
    }

    @Test
    @DisplayName("Malformed or invalid configurations are rejected")
    void invalidConfigurations() {
        assertThatThrownBy(() -> CuttingBoardConfig.load("cutting-board-broken.json"))
                .isInstanceOf(CubeException.class)
                .hasMessageContaining("cutting-board-broken.json");
        assertThatThrownBy(() -> CuttingBoardConfig.parse("{\"cacheCapacity\": 0}"))
                .isInstanceOf(CubeException.class);
        assertThatThrownBy(() -> CuttingBoardConfig.defaults().withCacheCapacity(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Unknown strategy names are rejected by the board")
    void unknownStrategy() {
        CuttingBoardConfig config = CuttingBoardConfig.defaults().withStrategies(List.of("reuse", "guess"));

        assertThatThrownBy(() -> new CuttingBoard(Sales.cube(), Dataset.of(Sales.RECORDS), config))
                .isInstanceOf(CubeException.class)
                .hasMessageContaining("guess");
    }
}
