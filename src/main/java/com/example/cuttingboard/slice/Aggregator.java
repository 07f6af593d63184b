package com.example.cuttingboard.slice;

import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Aggregates the items of an Iterable into a result in a single pass.
 *
 * <p>This is the Iterator-based counterpart of {@link java.util.stream.Collector}:
 * <ol>
 *   <li><b>Initialization:</b> a mutable container from {@link #supplier()}</li>
 *   <li><b>Accumulation:</b> each item through {@link #accumulator()}</li>
 *   <li><b>Finishing:</b> the container into the result via {@link #finisher()}</li>
 * </ol>
 *
 * @param <T> the type of input elements
 * @param <A> the mutable container type
 * @param <R> the result type
 */
public interface Aggregator<T, A, R> {

    Supplier<A> supplier();

    BiConsumer<A, T> accumulator();

    Function<A, R> finisher();

    /**
     * Combines two partial containers into one.
     *
     * @return the combiner, or {@code null} if the aggregator is sequential only
     */
    default BinaryOperator<A> combiner() {
        return null;
    }

    default R aggregate(Iterable<? extends T> source) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            accFn.accept(acc, item);
        }
        return finisher().apply(acc);
    }

    /**
     * Aggregates the items of the source that match the filter; the others are skipped.
     */
    default R aggregateFiltered(Iterable<? extends T> source, Predicate<? super T> filter) {
        A acc = supplier().get();
        BiConsumer<A, T> accFn = accumulator();
        for (T item : source) {
            if (filter.test(item)) {
                accFn.accept(acc, item);
            }
        }
        return finisher().apply(acc);
    }
}
