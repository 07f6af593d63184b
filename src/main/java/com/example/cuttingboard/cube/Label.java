package com.example.cuttingboard.cube;

import com.example.cuttingboard.Attributes;
import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.accumulator.Group;
import com.example.cuttingboard.accumulator.Numbers;
import com.example.cuttingboard.accumulator.Sum;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Definition of a named way to read the records of a dataset.
 *
 * <p>A label used as an axis groups records by its extracted value; a label
 * used as a value (a measure) is aggregated with a fresh accumulator per
 * group. Labels are immutable: the {@code with*} methods return new
 * instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * Label month = Label.label("month", r -> ((Sale) r).date().getMonthValue());
 * Label amount = Label.measure("amount");                 // Sum of the "amount" attribute
 * Label avg = Label.measure("avg_amount", r -> ((Sale) r).amount())
 *         .withAccumulator(Average::new);
 * }</pre>
 */
public final class Label {

    /**
     * Natural order with {@code null} first; numbers of different types compare by magnitude.
     */
    public static final Comparator<Object> NULLS_FIRST = Comparator.nullsFirst(Numbers::compare);

    private final String name;
    private final String title;
    private final Function<Object, ?> extractor;
    private final Supplier<? extends Accumulator> accumulator;
    private final Comparator<Object> order;
    private final boolean reverse;

    private Label(
            String name,
            String title,
            Function<Object, ?> extractor,
            Supplier<? extends Accumulator> accumulator,
            Comparator<Object> order,
            boolean reverse
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.title = title;
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.accumulator = Objects.requireNonNull(accumulator, "accumulator must not be null");
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.reverse = reverse;
    }

    /**
     * Creates a label reading the attribute with the same name, accumulated with {@link Group}.
     */
    public static Label label(String name) {
        return label(name, Attributes.getter(name));
    }

    public static Label label(String name, Function<Object, ?> extractor) {
        return new Label(name, null, extractor, Group::new, NULLS_FIRST, false);
    }

    /**
     * Creates a measure reading the attribute with the same name, accumulated with {@link Sum}.
     */
    public static Label measure(String name) {
        return measure(name, Attributes.getter(name));
    }

    public static Label measure(String name, Function<Object, ?> extractor) {
        return new Label(name, null, extractor, Sum::new, NULLS_FIRST, false);
    }

    public Label withAccumulator(Supplier<? extends Accumulator> accumulator) {
        return new Label(name, title, extractor, accumulator, order, reverse);
    }

    public Label withOrder(Comparator<Object> order) {
        return new Label(name, title, extractor, accumulator, order, reverse);
    }

    public Label withTitle(String title) {
        return new Label(name, title, extractor, accumulator, order, reverse);
    }

    /**
     * Returns a label whose values are listed in descending order.
     */
    public Label reversed() {
        return new Label(name, title, extractor, accumulator, order, !reverse);
    }

    public String name() {
        return name;
    }

    /**
     * Returns the human readable name: the explicit title if set, else the
     * name with underscores turned into spaces and words capitalized.
     */
    public String title() {
        if (title != null) {
            return title;
        }
        StringBuilder sb = new StringBuilder(name.length());
        boolean start = true;
        for (char c : name.replace('_', ' ').toCharArray()) {
            sb.append(start ? Character.toUpperCase(c) : c);
            start = c == ' ';
        }
        return sb.toString();
    }

    public Object extract(Object record) {
        return extractor.apply(record);
    }

    public Accumulator newAccumulator() {
        return accumulator.get();
    }

    public boolean isReverse() {
        return reverse;
    }

    /**
     * Returns the order in which the values of this label are listed,
     * already reversed if the label is.
     */
    public Comparator<Object> comparator() {
        return reverse ? order.reversed() : order;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return name.equals(((Label) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Label(" + name + ")";
    }
}
