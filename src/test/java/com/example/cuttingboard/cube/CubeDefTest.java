package com.example.cuttingboard.cube;

import com.example.cuttingboard.DataException;
import com.example.cuttingboard.Sales;
import com.example.cuttingboard.accumulator.Group;
import com.example.cuttingboard.accumulator.Max;
import com.example.cuttingboard.accumulator.Sum;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CubeDef and Label.
 */
class CubeDefTest {

    @Test
    @DisplayName("Labels group and measures sum by default")
    void defaultAccumulators() {
        CubeDef cube = Sales.cube();

        assertThat(cube.getLabel("item").newAccumulator()).isInstanceOf(Group.class);
        assertThat(cube.getMeasure("number").newAccumulator()).isInstanceOf(Sum.class);
        assertThat(Label.measure("top").withAccumulator(Max::new).newAccumulator()).isInstanceOf(Max.class);
    }

    @Test
    @DisplayName("Measures fall back to labels; undefined names fail")
    void lookups() {
        CubeDef cube = Sales.cube();

        assertThat(cube.getMeasure("place").name()).isEqualTo("place");
        assertThatThrownBy(() -> cube.getLabel("number"))
                .isInstanceOf(DataException.class)
                .hasMessage("label not defined: 'number'");
        assertThatThrownBy(() -> cube.getMeasure("price"))
                .isInstanceOf(DataException.class)
                .hasMessage("measure not defined: 'price'");
    }

    @Test
    @DisplayName("Titles are derived from names unless set")
    void titles() {
        assertThat(Label.label("unit_price").title()).isEqualTo("Unit Price");
        assertThat(Label.label("unit_price").withTitle("Price").title()).isEqualTo("Price");
    }

    @Test
    @DisplayName("Labels sort nulls first, or last when reversed")
    void ordering() {
        List<Object> values = new ArrayList<>(Arrays.asList(3, null, 1.5, 2L));

        values.sort(Label.label("x").comparator());
        assertThat(values).containsExactly(null, 1.5, 2L, 3);

        values.sort(Label.label("x").reversed().comparator());
        assertThat(values).containsExactly(3, 2L, 1.5, null);
    }

    @Test
    @DisplayName("Labels are equal by name")
    void equality() {
        assertThat(Label.label("item")).isEqualTo(Label.measure("item", r -> 1));
        assertThat(Sales.cube().getLabels()).extracting(Label::name).containsExactly("month", "item", "place");
    }
}
