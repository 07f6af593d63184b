package com.example.cuttingboard.accumulator;

/**
 * Special accumulator states.
 *
 * <p>{@link #UNUSED} marks a slot that never received a value;
 * {@link #INCONSISTENT} marks an aggregate that received inputs it can't
 * reconcile. Once an accumulator degrades to {@code INCONSISTENT} it stays
 * there: further adds and merges are ignored and {@link #get()} returns
 * {@code null}.
 */
public enum Sentinel implements Accumulator {

    UNUSED {
        @Override
        public void add(Object value, Object record) {
            throw new IllegalStateException("an unused marker can't receive values");
        }

        @Override
        public Accumulator merge(Accumulator other) {
            return other.copy();
        }
    },

    INCONSISTENT {
        @Override
        public void add(Object value, Object record) {
            // stays inconsistent
        }

        @Override
        public Accumulator merge(Accumulator other) {
            return this;
        }
    };

    @Override
    public Object get() {
        return null;
    }

    @Override
    public Accumulator copy() {
        return this;
    }
}
