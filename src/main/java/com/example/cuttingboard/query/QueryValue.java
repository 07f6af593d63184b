package com.example.cuttingboard.query;

/**
 * A value requested by a query.
 *
 * @param name the measure name
 * @param visible {@code false} if the value is only computed because other values rely on it
 */
public record QueryValue(String name, boolean visible) {
}
