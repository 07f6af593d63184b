package com.example.cuttingboard.accumulator;

/**
 * The largest of the values received, {@code null} until the first non-null value.
 *
 * <p>Numbers of different types are compared by magnitude, other values by
 * their natural order.
 */
public final class Max extends MergeableAccumulator<Max> {

    private Object acc;

    public Max() {
        super(Max.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (value == null) {
            return;
        }
        if (acc == null || Numbers.compare(value, acc) > 0) {
            acc = value;
        }
    }

    @Override
    public Object get() {
        return acc;
    }

    @Override
    protected Accumulator combine(Max other) {
        add(other.acc, null);
        return this;
    }

    @Override
    public Max copy() {
        Max rv = new Max();
        rv.acc = acc;
        return rv;
    }
}
