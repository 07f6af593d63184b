package com.example.cuttingboard.accumulator;

/**
 * Sum of the values received.
 *
 * <p>{@code null} values are skipped rather than counted as zero, so a sum
 * that only received nulls (or nothing at all) returns {@code null}.
 */
public final class Sum extends MergeableAccumulator<Sum> {

    private Number acc;

    public Sum() {
        super(Sum.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (value == null) {
            return;
        }
        Number n = Numbers.toNumber(value);
        acc = acc == null ? n : Numbers.add(acc, n);
    }

    @Override
    public Number get() {
        return acc;
    }

    @Override
    protected Accumulator combine(Sum other) {
        if (acc == null) {
            acc = other.acc;
        } else if (other.acc != null) {
            acc = Numbers.add(acc, other.acc);
        }
        return this;
    }

    @Override
    public Sum copy() {
        Sum rv = new Sum();
        rv.acc = acc;
        return rv;
    }
}
