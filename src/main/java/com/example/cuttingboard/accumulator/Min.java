package com.example.cuttingboard.accumulator;

/**
 * The smallest of the values received, {@code null} until the first non-null value.
 *
 * <p>Numbers of different types are compared by magnitude, other values by
 * their natural order.
 */
public final class Min extends MergeableAccumulator<Min> {

    private Object acc;

    public Min() {
        super(Min.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (value == null) {
            return;
        }
        if (acc == null || Numbers.compare(value, acc) < 0) {
            acc = value;
        }
    }

    @Override
    public Object get() {
        return acc;
    }

    @Override
    protected Accumulator combine(Min other) {
        add(other.acc, null);
        return this;
    }

    @Override
    public Min copy() {
        Min rv = new Min();
        rv.acc = acc;
        return rv;
    }
}
