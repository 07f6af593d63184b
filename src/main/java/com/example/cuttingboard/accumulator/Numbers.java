package com.example.cuttingboard.accumulator;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Arithmetic and ordering over boxed numbers of mixed types.
 *
 * <p>Integral values are widened to {@code long}, decimal values stay
 * {@link BigDecimal} and everything else becomes {@code double}.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Converts a value received by a numeric accumulator.
     *
     * @throws IllegalArgumentException if the value is not a number
     */
    public static Number toNumber(Object value) {
        if (value instanceof Number) {
            return normalize((Number) value);
        }
        throw new IllegalArgumentException("expected a number, got " + value.getClass().getName() + ": " + value);
    }

    public static Number normalize(Number n) {
        if (isIntegral(n)) {
            return n.longValue();
        }
        if (n instanceof BigDecimal) {
            return n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        return n.doubleValue();
    }

    /**
     * Adds two numbers; a {@code long} sum that overflows is widened to {@link BigDecimal}.
     */
    public static Number add(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            try {
                return Math.addExact(a.longValue(), b.longValue());
            } catch (ArithmeticException e) {
                return BigDecimal.valueOf(a.longValue()).add(BigDecimal.valueOf(b.longValue()));
            }
        }
        if (isDecimal(a) || isDecimal(b)) {
            return toBigDecimal(a).add(toBigDecimal(b));
        }
        return a.doubleValue() + b.doubleValue();
    }

    /**
     * Compares two values: numbers by magnitude whatever their type, anything
     * else by its natural order.
     *
     * @throws IllegalArgumentException if the values can't be compared
     */
    public static int compare(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            Number x = (Number) a;
            Number y = (Number) b;
            if (isIntegral(x) && isIntegral(y)) {
                return Long.compare(x.longValue(), y.longValue());
            }
            if (isDecimal(x) || isDecimal(y)) {
                return toBigDecimal(x).compareTo(toBigDecimal(y));
            }
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return naturalOrder(a).compareTo(b);
        }
        if (b instanceof Comparable && b.getClass().isInstance(a)) {
            return -naturalOrder(b).compareTo(a);
        }
        throw new IllegalArgumentException("can't compare " + a + " with " + b);
    }

    private static Comparable<Object> naturalOrder(Object value) {
        return (Comparable<Object>) value;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static boolean isDecimal(Number n) {
        return n instanceof BigDecimal || n instanceof BigInteger;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (n instanceof BigInteger) {
            return new BigDecimal((BigInteger) n);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }
}
