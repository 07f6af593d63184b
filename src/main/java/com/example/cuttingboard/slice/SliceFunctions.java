package com.example.cuttingboard.slice;

import com.example.cuttingboard.DataException;
import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.cube.CubeDefinition;
import com.example.cuttingboard.cube.Label;
import com.example.cuttingboard.query.CubeQuery;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The per-record functions of a query, resolved once against the cube.
 *
 * <ul>
 *   <li>{@link #key(Object)}: the tuple of axis values of a record</li>
 *   <li>{@link #zero()}: a fresh accumulator per value to compute</li>
 *   <li>{@link #accumulate(Map, Object)}: adds a record to a cell</li>
 * </ul>
 *
 * <p>Labels are looked up when the functions are built, so an undefined
 * name fails before any record is read.
 */
public final class SliceFunctions {

    private final Label[] axes;
    private final Label[] measures;

    private SliceFunctions(Label[] axes, Label[] measures) {
        this.axes = axes;
        this.measures = measures;
    }

    /**
     * Resolves the functions of a query.
     *
     * @throws DataException if the query uses a name the cube doesn't define
     */
    public static SliceFunctions of(CubeQuery query, CubeDefinition cube) {
        List<String> axisNames = query.axes();
        Label[] axes = new Label[axisNames.size()];
        for (int i = 0; i < axes.length; i++) {
            axes[i] = cube.getLabel(axisNames.get(i));
        }

        List<String> valueNames = query.sliceValues();
        Label[] measures = new Label[valueNames.size()];
        for (int i = 0; i < measures.length; i++) {
            measures[i] = cube.getMeasure(valueNames.get(i));
        }
        return new SliceFunctions(axes, measures);
    }

    public List<Object> key(Object record) {
        Object[] key = new Object[axes.length];
        for (int i = 0; i < axes.length; i++) {
            key[i] = axes[i].extract(record);
        }
        return Collections.unmodifiableList(Arrays.asList(key));
    }

    public Map<String, Accumulator> zero() {
        Map<String, Accumulator> rv = new LinkedHashMap<>();
        for (Label m : measures) {
            rv.put(m.name(), m.newAccumulator());
        }
        return rv;
    }

    public void accumulate(Map<String, Accumulator> cell, Object record) {
        for (Label m : measures) {
            cell.get(m.name()).add(m.extract(record), record);
        }
    }

    public List<Label> axisLabels() {
        return List.of(axes);
    }

    public List<Label> valueLabels() {
        return List.of(measures);
    }
}
