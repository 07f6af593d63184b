package com.example.cuttingboard.accumulator;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Wraps an accumulator so it only combines values sharing the same label.
 *
 * <p>The label is read from each record; it behaves like a {@link Group}: the
 * first label wins and a record with a different label makes the wrapped
 * accumulator {@link Sentinel#INCONSISTENT}. Typical use is summing amounts
 * only when they are expressed in the same currency:
 * <pre>{@code
 * Supplier<Accumulator> amounts = LabeledAcc.of(r -> ((Trade) r).currency(), Sum::new);
 * }</pre>
 */
public final class LabeledAcc extends MergeableAccumulator<LabeledAcc> {

    private final Function<Object, ?> labelGetter;
    private Accumulator acc;
    private Object label = Sentinel.UNUSED;

    public LabeledAcc(Function<Object, ?> labelGetter, Accumulator acc) {
        super(LabeledAcc.class);
        this.labelGetter = Objects.requireNonNull(labelGetter, "labelGetter must not be null");
        this.acc = Objects.requireNonNull(acc, "acc must not be null");
    }

    /**
     * Returns a factory of labeled accumulators wrapping fresh instances of
     * the given accumulator.
     */
    public static Supplier<Accumulator> of(Function<Object, ?> labelGetter, Supplier<? extends Accumulator> inner) {
        return () -> new LabeledAcc(labelGetter, inner.get());
    }

    @Override
    public void add(Object value, Object record) {
        if (label == Sentinel.UNUSED) {
            label = labelGetter.apply(record);
            acc.add(value, record);
            return;
        }
        if (acc == Sentinel.INCONSISTENT) {
            return;
        }
        if (Objects.equals(label, labelGetter.apply(record))) {
            acc.add(value, record);
        } else {
            acc = Sentinel.INCONSISTENT;
        }
    }

    @Override
    public Object get() {
        return acc.get();
    }

    /**
     * Returns the label shared by the records, or {@code null} if no record was received.
     */
    public Object label() {
        return label == Sentinel.UNUSED ? null : label;
    }

    @Override
    protected Accumulator combine(LabeledAcc other) {
        if (acc == Sentinel.INCONSISTENT) {
            return this;
        }
        if (other.acc == Sentinel.INCONSISTENT) {
            acc = Sentinel.INCONSISTENT;
            return this;
        }
        if (other.label == Sentinel.UNUSED) {
            return this;
        }
        if (label == Sentinel.UNUSED) {
            label = other.label;
        }
        acc = Objects.equals(label, other.label) ? acc.merge(other.acc) : Sentinel.INCONSISTENT;
        return this;
    }

    @Override
    public LabeledAcc copy() {
        LabeledAcc rv = new LabeledAcc(labelGetter, acc.copy());
        rv.label = label;
        return rv;
    }

    @Override
    public String toString() {
        return "LabeledAcc(" + label + ", " + acc + ")";
    }
}
