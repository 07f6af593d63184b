package com.example.cuttingboard.accumulator;

import java.util.Objects;

/**
 * Constant-or-inconsistent accumulator, the default for labels.
 *
 * <p>Used for attributes expected to be constant within a group, e.g. the
 * currency of an account when grouping by account. The first non-null value
 * is kept; a later different value makes the group inconsistent for good and
 * {@link #get()} returns {@code null}.
 */
public final class Group extends MergeableAccumulator<Group> {

    // either a value, or one of the sentinels
    private Object value = Sentinel.UNUSED;

    public Group() {
        super(Group.class);
    }

    @Override
    public void add(Object v, Object record) {
        if (v == null || value == Sentinel.INCONSISTENT) {
            return;
        }
        if (value == Sentinel.UNUSED) {
            value = v;
        } else if (!Objects.equals(value, v)) {
            value = Sentinel.INCONSISTENT;
        }
    }

    @Override
    public Object get() {
        return value instanceof Sentinel ? null : value;
    }

    /**
     * Returns {@code true} if conflicting values were received.
     */
    public boolean isInconsistent() {
        return value == Sentinel.INCONSISTENT;
    }

    @Override
    protected Accumulator combine(Group other) {
        if (value == Sentinel.INCONSISTENT || other.value == Sentinel.UNUSED) {
            return this;
        }
        if (value == Sentinel.UNUSED || other.value == Sentinel.INCONSISTENT) {
            value = other.value;
        } else if (!Objects.equals(value, other.value)) {
            value = Sentinel.INCONSISTENT;
        }
        return this;
    }

    @Override
    public Group copy() {
        Group rv = new Group();
        rv.value = value;
        return rv;
    }
}
