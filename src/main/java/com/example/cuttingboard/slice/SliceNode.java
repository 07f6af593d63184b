package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;

import java.util.Map;

/**
 * A node of a slice tree.
 *
 * <p>Inner levels are {@link Branch}es mapping one axis value to the next
 * level; the innermost level is a {@link Leaf} holding one accumulator per
 * value name. The depth of the tree is the dimension of the query it was
 * built for: a 0-dimension slice is a single leaf.
 */
public interface SliceNode {

    /**
     * The accumulators of one cell, by value name.
     */
    record Leaf(Map<String, Accumulator> accumulators) implements SliceNode {
    }

    /**
     * The sub-trees of one level, by axis value.
     */
    record Branch(Map<Object, SliceNode> children) implements SliceNode {
    }
}
