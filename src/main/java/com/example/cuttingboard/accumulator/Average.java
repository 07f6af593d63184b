package com.example.cuttingboard.accumulator;

/**
 * Arithmetic mean of the values received.
 *
 * <p>Only the running sum and count are stored: the mean is computed by
 * {@link #get()}. {@code null} values are skipped.
 */
public final class Average extends MergeableAccumulator<Average> {

    private Number sum;
    private long count = 0;

    public Average() {
        super(Average.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (value == null) {
            return;
        }
        Number n = Numbers.toNumber(value);
        sum = sum == null ? n : Numbers.add(sum, n);
        count++;
    }

    /**
     * Returns the mean, or {@code null} if no value was received.
     */
    @Override
    public Double get() {
        return count > 0 ? sum.doubleValue() / count : null;
    }

    @Override
    protected Accumulator combine(Average other) {
        if (other.count == 0) {
            return this;
        }
        sum = sum == null ? other.sum : Numbers.add(sum, other.sum);
        count += other.count;
        return this;
    }

    @Override
    public Average copy() {
        Average rv = new Average();
        rv.sum = sum;
        rv.count = count;
        return rv;
    }
}
