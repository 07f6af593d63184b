package com.example.cuttingboard.cube;

import com.example.cuttingboard.DataException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory cube definition built by registering labels and measures.
 *
 * <p>Example usage:
 * <pre>{@code
 * CubeDef cube = new CubeDef()
 *         .addLabel(Label.label("month", r -> ((Sale) r).date().getMonthValue()))
 *         .addLabel(Label.label("item"))
 *         .addMeasure(Label.measure("number"));
 * }</pre>
 *
 * <p>Registration is not synchronized: complete the definition before
 * sharing it between threads.
 */
public class CubeDef implements CubeDefinition {

    private final Map<String, Label> labels = new LinkedHashMap<>();
    private final Map<String, Label> measures = new LinkedHashMap<>();

    public CubeDef addLabel(Label label) {
        labels.put(label.name(), label);
        return this;
    }

    public CubeDef addMeasure(Label measure) {
        measures.put(measure.name(), measure);
        return this;
    }

    @Override
    public Label getLabel(String name) {
        Label label = labels.get(name);
        if (label == null) {
            throw new DataException("label not defined: '" + name + "'");
        }
        return label;
    }

    @Override
    public Label getMeasure(String name) {
        Label measure = measures.get(name);
        if (measure == null) {
            measure = labels.get(name);
        }
        if (measure == null) {
            throw new DataException("measure not defined: '" + name + "'");
        }
        return measure;
    }

    public List<Label> getLabels() {
        return new ArrayList<>(labels.values());
    }

    public List<Label> getMeasures() {
        return new ArrayList<>(measures.values());
    }
}
