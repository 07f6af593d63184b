package com.example.cuttingboard.accumulator;

/**
 * Sample standard deviation of the values received.
 *
 * <p>The state is updated incrementally with Welford's algorithm (Knuth,
 * TAOCP vol. 2, 4.2.2): running mean {@code m}, sum of squared differences
 * {@code s} and count {@code n}. The result is {@code sqrt(s / (n - 1))},
 * or {@code null} with fewer than two values.
 *
 * <p><b>Merging:</b> two partial states are not combined; merging always
 * yields {@link Sentinel#INCONSISTENT}, whose result is {@code null}. Slices
 * derived by regrouping cached cells therefore show no standard deviation
 * for the cells that had to be merged.
 */
public final class StdDev extends MergeableAccumulator<StdDev> {

    private long n = 0;
    private double m;
    private double s;

    public StdDev() {
        super(StdDev.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (value == null) {
            return;
        }
        double v = Numbers.toNumber(value).doubleValue();
        if (n > 0) {
            long k = n + 1;
            double m1 = m;
            m = m1 + (v - m1) / k;
            s += (v - m1) * (v - m);
            n = k;
        } else {
            m = v;
            s = 0.0;
            n = 1;
        }
    }

    @Override
    public Double get() {
        return n > 1 ? Math.sqrt(s / (n - 1)) : null;
    }

    @Override
    protected Accumulator combine(StdDev other) {
        return Sentinel.INCONSISTENT;
    }

    @Override
    public StdDev copy() {
        StdDev rv = new StdDev();
        rv.n = n;
        rv.m = m;
        rv.s = s;
        return rv;
    }
}
