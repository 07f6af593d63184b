package com.example.cuttingboard.cube;

import com.example.cuttingboard.DataException;

/**
 * Read-only access to the labels and measures that can be used in a query.
 */
public interface CubeDefinition {

    /**
     * Returns the label usable as an axis or in a filter.
     *
     * @throws DataException if no label is defined with that name
     */
    Label getLabel(String name);

    /**
     * Returns the label usable as a value. Labels can be shown as values
     * too, so this falls back on them when no measure has the name.
     *
     * @throws DataException if no measure or label is defined with that name
     */
    Label getMeasure(String name);
}
