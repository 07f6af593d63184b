package com.example.cuttingboard.query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * A single condition on a label: {@code name operator value}.
 *
 * <p>Values of multi-valued operators ({@code in}, {@code hasall}, ...) are
 * stored as unmodifiable sets, so two filters listing the same values in a
 * different order are equal.
 *
 * @param name the label the condition applies to
 * @param operator the comparison to apply
 * @param value the value to compare with, possibly {@code null}
 */
public record Filter(
        String name,
        FilterOperator operator,
        Object value
) {
    public Filter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (operator.isMultiValued() && value instanceof Collection) {
            value = Collections.unmodifiableSet(new LinkedHashSet<>((Collection<?>) value));
        }
    }

    public static Filter of(String name, String operator, Object value) {
        return new Filter(name, FilterOperator.of(operator), value);
    }

    public Filter withOperator(FilterOperator newOperator) {
        return new Filter(name, newOperator, value);
    }

    @Override
    public String toString() {
        return name + ":" + operator.code() + ":" + value;
    }
}
