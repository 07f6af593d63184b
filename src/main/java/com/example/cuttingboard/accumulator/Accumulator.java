package com.example.cuttingboard.accumulator;

/**
 * A mergeable partial aggregate over the values of one measure.
 *
 * <p>An accumulator is a small state machine: it starts empty, receives
 * zero or more {@code (value, record)} pairs through {@link #add(Object, Object)}
 * and exposes the current result through {@link #get()}. Two accumulators
 * built over disjoint sets of records can be combined with
 * {@link #merge(Accumulator)}, which is what lets a cached slice be regrouped
 * without reading the dataset again.
 *
 * <p>Example usage:
 * <pre>{@code
 * Accumulator left = new Sum();
 * left.add(10, record1);
 * Accumulator right = new Sum();
 * right.add(32, record2);
 *
 * Accumulator total = left.merge(right);
 * total.get(); // 42L
 * }</pre>
 *
 * <p>Merging is not guaranteed to succeed: variants that can't combine their
 * state (see {@link StdDev}) and merges between different variants return
 * {@link Sentinel#INCONSISTENT}. Callers must always keep the returned
 * instance rather than assuming the receiver was updated.
 *
 * <p><b>Thread Safety:</b> accumulators are NOT thread-safe. Each aggregation
 * pass owns its own accumulators.
 */
public interface Accumulator {

    /**
     * Incorporates a value extracted from a record.
     *
     * @param value the extracted value, possibly {@code null}
     * @param record the record the value was extracted from
     */
    void add(Object value, Object record);

    /**
     * Returns the current result, or {@code null} if there is no data to
     * produce one.
     *
     * @return the aggregated result
     */
    Object get();

    /**
     * Combines the state of another accumulator, built over a disjoint set of
     * records, into this one.
     *
     * <p>The other accumulator is not modified.
     *
     * @param other the accumulator to combine with
     * @return the combined accumulator: usually {@code this}, or
     *         {@link Sentinel#INCONSISTENT} if the states can't be combined
     */
    Accumulator merge(Accumulator other);

    /**
     * Returns an independent accumulator with the same state.
     *
     * @return a copy of this accumulator
     */
    Accumulator copy();
}
