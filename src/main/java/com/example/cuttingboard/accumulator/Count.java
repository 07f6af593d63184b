package com.example.cuttingboard.accumulator;

/**
 * Number of records received, whatever their value.
 */
public final class Count extends MergeableAccumulator<Count> {

    private long count = 0;

    public Count() {
        super(Count.class);
    }

    @Override
    public void add(Object value, Object record) {
        count++;
    }

    @Override
    public Long get() {
        return count;
    }

    @Override
    protected Accumulator combine(Count other) {
        count += other.count;
        return this;
    }

    @Override
    public Count copy() {
        Count rv = new Count();
        rv.count = count;
        return rv;
    }
}
