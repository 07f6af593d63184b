package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Conversions between flat {@code key -> cell} bins and slice trees, and
 * operations on cells.
 *
 * <p>Trees built here are read-only: their maps are wrapped as unmodifiable.
 */
public final class SliceTrees {

    private SliceTrees() {
    }

    /**
     * Nests flat bins into a tree of the given depth, one level per key component.
     *
     * @param bins the cells by full key tuple; every key has {@code dim} components
     * @param dim the depth of the tree
     * @param zero creates the cell of a 0-dimension tree when there are no bins
     */
    public static SliceNode nest(
            Map<List<Object>, Map<String, Accumulator>> bins,
            int dim,
            Supplier<Map<String, Accumulator>> zero
    ) {
        if (dim == 0) {
            Map<String, Accumulator> cell = bins.get(List.of());
            return new SliceNode.Leaf(Collections.unmodifiableMap(cell != null ? cell : zero.get()));
        }

        return group(bins, 0, dim);
    }

    // every key of bins shares its first depth components
    private static SliceNode group(Map<List<Object>, Map<String, Accumulator>> bins, int depth, int dim) {
        if (depth == dim) {
            return new SliceNode.Leaf(Collections.unmodifiableMap(bins.values().iterator().next()));
        }
        Map<Object, Map<List<Object>, Map<String, Accumulator>>> groups = new HashMap<>();
        for (Map.Entry<List<Object>, Map<String, Accumulator>> e : bins.entrySet()) {
            groups.computeIfAbsent(e.getKey().get(depth), k -> new HashMap<>()).put(e.getKey(), e.getValue());
        }
        Map<Object, SliceNode> children = new HashMap<>(groups.size() * 2);
        for (Map.Entry<Object, Map<List<Object>, Map<String, Accumulator>>> e : groups.entrySet()) {
            children.put(e.getKey(), group(e.getValue(), depth + 1, dim));
        }
        return new SliceNode.Branch(Collections.unmodifiableMap(children));
    }

    /**
     * Visits every cell of a tree with its full key tuple.
     */
    public static void forEachCell(SliceNode root, int dim, BiConsumer<List<Object>, Map<String, Accumulator>> action) {
        visit(root, dim, new ArrayList<>(dim), action);
    }

    private static void visit(
            SliceNode node,
            int dim,
            List<Object> prefix,
            BiConsumer<List<Object>, Map<String, Accumulator>> action
    ) {
        if (dim == 0) {
            action.accept(Collections.unmodifiableList(new ArrayList<>(prefix)), ((SliceNode.Leaf) node).accumulators());
            return;
        }
        for (Map.Entry<Object, SliceNode> e : ((SliceNode.Branch) node).children().entrySet()) {
            prefix.add(e.getKey());
            visit(e.getValue(), dim - 1, prefix, action);
            prefix.remove(prefix.size() - 1);
        }
    }

    /**
     * Returns an independent copy of the accumulators of a cell, restricted to the given names.
     */
    public static Map<String, Accumulator> copyCell(Map<String, Accumulator> cell, Collection<String> names) {
        Map<String, Accumulator> rv = new LinkedHashMap<>();
        for (String name : names) {
            Accumulator acc = cell.get(name);
            if (acc != null) {
                rv.put(name, acc.copy());
            }
        }
        return rv;
    }

    /**
     * Merges the accumulators of a cell into a target cell, name by name.
     * Names missing from the source are left untouched; the source is not modified.
     */
    public static void mergeInto(Map<String, Accumulator> target, Map<String, Accumulator> source) {
        for (Map.Entry<String, Accumulator> e : target.entrySet()) {
            Accumulator other = source.get(e.getKey());
            if (other != null) {
                e.setValue(e.getValue().merge(other));
            }
        }
    }
}
