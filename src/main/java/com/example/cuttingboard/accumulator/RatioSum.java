package com.example.cuttingboard.accumulator;

import com.example.cuttingboard.Attributes;

import java.util.function.Supplier;

/**
 * Ratio between the sums of two attributes of the records.
 *
 * <p>The value passed to {@link #add(Object, Object)} is ignored: the
 * numerator and denominator are read from the record itself. A record
 * without the numerator attribute contributes {@code 0.0}, one without the
 * denominator attribute contributes {@code 1.0}; a {@code null} attribute
 * contributes {@code 0.0}. The result is {@code null} when the denominator
 * sum is zero.
 */
public final class RatioSum extends MergeableAccumulator<RatioSum> {

    private final String numerator;
    private final String denominator;
    private double num = 0.0;
    private double denom = 0.0;
    private boolean touched = false;

    public RatioSum(String numerator, String denominator) {
        super(RatioSum.class);
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Supplier<Accumulator> of(String numerator, String denominator) {
        return () -> new RatioSum(numerator, denominator);
    }

    @Override
    public void add(Object value, Object record) {
        num += read(record, numerator, 0.0);
        denom += read(record, denominator, 1.0);
        touched = true;
    }

    @Override
    public Double get() {
        double d = touched ? denom : 1.0;
        if (d == 0.0) {
            return null;
        }
        return num / d;
    }

    @Override
    protected Accumulator combine(RatioSum other) {
        if (other.touched) {
            num += other.num;
            denom += other.denom;
            touched = true;
        }
        return this;
    }

    @Override
    public RatioSum copy() {
        RatioSum rv = new RatioSum(numerator, denominator);
        rv.num = num;
        rv.denom = denom;
        rv.touched = touched;
        return rv;
    }

    private static double read(Object record, String attribute, double missing) {
        if (!Attributes.has(record, attribute)) {
            return missing;
        }
        Object v = Attributes.get(record, attribute);
        return v == null ? 0.0 : Numbers.toNumber(v).doubleValue();
    }
}
