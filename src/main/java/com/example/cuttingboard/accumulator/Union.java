package com.example.cuttingboard.accumulator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Union of set-valued fields.
 *
 * <p>Besides the union itself the accumulator remembers whether any record
 * contributed an empty value ({@code null}, an empty collection or an empty
 * string), so "some records have no tags" can be told apart from "no record
 * was seen".
 */
public final class Union extends MergeableAccumulator<Union> {

    /**
     * The union and whether some input was empty.
     *
     * @param values the union of the values, {@code null} if no non-empty value was received
     * @param includedEmpty {@code true} if some input was empty
     */
    public record Result(Set<Object> values, boolean includedEmpty) {
    }

    private Set<Object> acc;
    private boolean includedEmpty = false;

    public Union() {
        super(Union.class);
    }

    @Override
    public void add(Object value, Object record) {
        if (isEmpty(value)) {
            includedEmpty = true;
        } else if (value instanceof Collection) {
            union((Collection<?>) value);
        } else {
            union(Collections.singleton(value));
        }
    }

    @Override
    public Result get() {
        return new Result(acc == null ? null : Collections.unmodifiableSet(acc), includedEmpty);
    }

    @Override
    protected Accumulator combine(Union other) {
        if (other.acc != null) {
            union(other.acc);
        }
        includedEmpty |= other.includedEmpty;
        return this;
    }

    @Override
    public Union copy() {
        Union rv = new Union();
        rv.acc = acc == null ? null : new LinkedHashSet<>(acc);
        rv.includedEmpty = includedEmpty;
        return rv;
    }

    private void union(Collection<?> values) {
        if (acc == null) {
            acc = new LinkedHashSet<>();
        }
        acc.addAll(values);
    }

    private static boolean isEmpty(Object value) {
        return value == null
                || (value instanceof Collection && ((Collection<?>) value).isEmpty())
                || "".equals(value);
    }
}
