package com.example.cuttingboard.accumulator;

/**
 * Base class for the accumulators whose state can be combined with another
 * instance of the same variant.
 *
 * <p>Handles the sentinel cases once: merging an {@link Sentinel#UNUSED}
 * accumulator is a no-op, merging an {@link Sentinel#INCONSISTENT} one or an
 * accumulator of another variant degrades the result.
 *
 * @param <A> the concrete accumulator type
 */
abstract class MergeableAccumulator<A extends MergeableAccumulator<A>> implements Accumulator {

    private final Class<A> type;

    protected MergeableAccumulator(Class<A> type) {
        this.type = type;
    }

    @Override
    public final Accumulator merge(Accumulator other) {
        if (other == Sentinel.UNUSED) {
            return this;
        }
        if (!type.isInstance(other)) {
            return Sentinel.INCONSISTENT;
        }
        return combine(type.cast(other));
    }

    /**
     * Combines the state of an accumulator of the same variant.
     *
     * @param other the accumulator to combine with, never modified
     * @return the combined accumulator
     */
    protected abstract Accumulator combine(A other);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + get() + ")";
    }
}
