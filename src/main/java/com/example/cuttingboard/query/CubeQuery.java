package com.example.cuttingboard.query;

import com.example.cuttingboard.QueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Description of a query over a cube: which axes to group by, which values
 * to show, which filters to apply, which axes to pivot and how to sort.
 *
 * <p>Queries are immutable. Every transformation returns a new query and
 * leaves the receiver untouched, so queries can be shared freely, e.g. as
 * cache keys or between threads.
 *
 * <p>Example usage:
 * <pre>{@code
 * CubeQuery query = new CubeQuery()
 *         .addAxis("month")
 *         .addAxis("item")
 *         .addValue("number")
 *         .addFilter("place", "italy");
 *
 * // drill into January: a new query, the original is unchanged
 * CubeQuery january = query.removeAxis("month").addFilter("month", 1);
 * }</pre>
 *
 * <p>Pivoted axes are always the last ones: axes added without an explicit
 * position go just before them.
 */
public final class CubeQuery {

    private final List<String> axes;
    private final List<QueryValue> values;
    private final List<Filter> filters;
    private final List<String> hiddenValues;
    private final Set<String> pivots;
    private QueryOrder order;

    /**
     * Creates an empty query: no axes, values or filters.
     */
    public CubeQuery() {
        this.axes = new ArrayList<>();
        this.values = new ArrayList<>();
        this.filters = new ArrayList<>();
        this.hiddenValues = new ArrayList<>();
        this.pivots = new LinkedHashSet<>();
        this.order = null;
    }

    // Copy used by the transformations: the new instance is only modified
    // before being returned.
    private CubeQuery(CubeQuery other) {
        this.axes = new ArrayList<>(other.axes);
        this.values = new ArrayList<>(other.values);
        this.filters = new ArrayList<>(other.filters);
        this.hiddenValues = new ArrayList<>(other.hiddenValues);
        this.pivots = new LinkedHashSet<>(other.pivots);
        this.order = other.order;
    }

    private CubeQuery copy() {
        return new CubeQuery(this);
    }

    // =========================================================================
    // STATE
    // =========================================================================

    /**
     * Returns the number of axes, i.e. the depth of the resulting slice.
     */
    public int dim() {
        return axes.size();
    }

    public List<String> axes() {
        return Collections.unmodifiableList(axes);
    }

    /**
     * Returns the names of the values to show: visible and not hidden by the user.
     */
    public List<String> values() {
        List<String> rv = new ArrayList<>();
        for (QueryValue v : values) {
            if (v.visible() && !hiddenValues.contains(v.name())) {
                rv.add(v.name());
            }
        }
        return rv;
    }

    /**
     * Returns the names of all the values, visible or not.
     */
    public List<String> allValues() {
        List<String> rv = new ArrayList<>(values.size());
        for (QueryValue v : values) {
            rv.add(v.name());
        }
        return rv;
    }

    /**
     * Returns the names of the values whose accumulators must be computed.
     *
     * <p>Values added as not visible are included: other values may rely on
     * them (e.g. a currency code making a sum of amounts meaningful). Values
     * the user chose to hide are not.
     */
    public List<String> sliceValues() {
        List<String> rv = new ArrayList<>(values.size());
        for (QueryValue v : values) {
            if (!hiddenValues.contains(v.name())) {
                rv.add(v.name());
            }
        }
        return rv;
    }

    public List<QueryValue> valueSpecs() {
        return Collections.unmodifiableList(values);
    }

    public List<String> hiddenValues() {
        return Collections.unmodifiableList(hiddenValues);
    }

    public List<Filter> filters() {
        return Collections.unmodifiableList(filters);
    }

    /**
     * Returns the filters ignoring their order: they are ANDed together.
     */
    public Set<Filter> filterSet() {
        return Collections.unmodifiableSet(new HashSet<>(filters));
    }

    public Optional<QueryOrder> order() {
        return Optional.ofNullable(order);
    }

    /**
     * Returns the pivoted axes, in axis order.
     */
    public List<String> pivot() {
        List<String> rv = new ArrayList<>();
        for (String axis : axes) {
            if (pivots.contains(axis)) {
                rv.add(axis);
            }
        }
        return rv;
    }

    public boolean isPivot(String axis) {
        return pivots.contains(axis);
    }

    /**
     * Returns {@code true} if the name is an axis or has a filter.
     */
    public boolean hasAxis(String name) {
        if (axes.contains(name)) {
            return true;
        }
        for (Filter f : filters) {
            if (f.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if the label is an axis or is fixed by an equality filter.
     *
     * <p>Used to decide whether a query is refined enough to show values that
     * only make sense within one label value (e.g. amounts in one currency).
     */
    public boolean usesAxis(String name) {
        if (axes.contains(name)) {
            return true;
        }
        return findFilter(name, FilterOperator.EQ).isPresent();
    }

    /**
     * Returns the first filter on a label with the given operator.
     */
    public Optional<Filter> findFilter(String name, FilterOperator operator) {
        for (Filter f : filters) {
            if (f.name().equals(name) && f.operator() == operator) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the interval an axis is restricted to by its {@code ge},
     * {@code le} and {@code eq} filters. An equality filter settles both ends.
     */
    public Range getRange(String axis) {
        Object from = null;
        Object to = null;
        for (Filter f : filters) {
            if (!f.name().equals(axis)) {
                continue;
            }
            if (f.operator() == FilterOperator.GE) {
                from = f.value();
            } else if (f.operator() == FilterOperator.LE) {
                to = f.value();
            } else if (f.operator() == FilterOperator.EQ) {
                return new Range(f.value(), f.value());
            }
        }
        return new Range(from, to);
    }

    /**
     * Bounds of an axis, {@code null} where unbounded.
     */
    public record Range(Object from, Object to) {
    }

    // =========================================================================
    // AXES
    // =========================================================================

    /**
     * Returns a query with an added axis, placed before the pivoted axes.
     *
     * @throws QueryException if the axis is already in the query
     */
    public CubeQuery addAxis(String name) {
        return insertAxis(name, axes.size() - pivots.size());
    }

    /**
     * Returns a query with an axis added just before another one.
     *
     * @throws QueryException if {@code before} is not an axis of the query
     */
    public CubeQuery addAxisBefore(String name, String before) {
        return insertAxis(name, indexOfAxis(before));
    }

    /**
     * Returns a query with an axis added just after another one.
     *
     * @throws QueryException if {@code after} is not an axis of the query
     */
    public CubeQuery addAxisAfter(String name, String after) {
        return insertAxis(name, indexOfAxis(after) + 1);
    }

    private CubeQuery insertAxis(String name, int pos) {
        if (axes.contains(name)) {
            throw new QueryException("axis already in query: '" + name + "'");
        }
        CubeQuery rv = copy();
        rv.axes.add(pos, name);
        return rv;
    }

    private int indexOfAxis(String name) {
        int i = axes.indexOf(name);
        if (i < 0) {
            throw new QueryException("axis not in query: '" + name + "'");
        }
        return i;
    }

    public CubeQuery removeAxis(String name) {
        CubeQuery rv = copy();
        rv.axes.remove(name);
        if (rv.pivots.remove(name)) {
            rv.dropPivotOrder();
        }
        return rv;
    }

    // =========================================================================
    // VALUES
    // =========================================================================

    public CubeQuery addValue(String name) {
        return addValue(name, true);
    }

    /**
     * Returns a query with an added value. A value with the same name is
     * replaced and moved last.
     */
    public CubeQuery addValue(String name, boolean visible) {
        CubeQuery rv = removeValue(name);
        rv.values.add(new QueryValue(name, visible));
        return rv;
    }

    public CubeQuery removeValue(String name) {
        CubeQuery rv = copy();
        rv.values.removeIf(v -> v.name().equals(name));
        return rv;
    }

    public CubeQuery hideValue(String name) {
        CubeQuery rv = copy();
        if (!rv.hiddenValues.contains(name)) {
            rv.hiddenValues.add(name);
        }
        return rv;
    }

    public CubeQuery showValue(String name) {
        CubeQuery rv = copy();
        rv.hiddenValues.remove(name);
        return rv;
    }

    // =========================================================================
    // FILTERS
    // =========================================================================

    public CubeQuery addFilter(String name, Object value) {
        return addFilter(name, value, FilterOperator.EQ);
    }

    /**
     * @throws QueryException if the operator code is unknown
     */
    public CubeQuery addFilter(String name, Object value, String operator) {
        return addFilter(name, value, FilterOperator.of(operator));
    }

    public CubeQuery addFilter(String name, Object value, FilterOperator operator) {
        CubeQuery rv = copy();
        Filter f = new Filter(name, operator, value);
        if (!rv.filters.contains(f)) {
            rv.filters.add(f);
        }
        return rv;
    }

    /**
     * Returns a query without any filter on the label.
     */
    public CubeQuery removeFilter(String name) {
        CubeQuery rv = copy();
        rv.filters.removeIf(f -> f.name().equals(name));
        return rv;
    }

    /**
     * Returns a query without the filter {@code name operator value}.
     * A {@code null} operator removes all the filters on the label.
     */
    public CubeQuery removeFilter(String name, Object value, FilterOperator operator) {
        if (operator == null) {
            return removeFilter(name);
        }
        Filter target = new Filter(name, operator, value);
        CubeQuery rv = copy();
        rv.filters.removeIf(target::equals);
        return rv;
    }

    /**
     * Returns a query where the filter {@code name operator value} uses another operator.
     */
    public CubeQuery swapFilter(String name, Object value, FilterOperator operator, FilterOperator newOperator) {
        Filter original = new Filter(name, operator, value);
        Filter replacement = new Filter(name, newOperator, value);
        CubeQuery rv = copy();
        rv.filters.replaceAll(f -> f.equals(original) ? replacement : f);
        return rv;
    }

    /**
     * Returns a query where the filter {@code name operator value} is replaced by its complement.
     */
    public CubeQuery invertFilter(String name, Object value, FilterOperator operator) {
        return swapFilter(name, value, operator, operator.inverse());
    }

    /**
     * Returns, for each operator of the same family, the query obtained
     * swapping the filter's operator with it.
     */
    public Map<FilterOperator, CubeQuery> relatedFilters(String name, Object value, FilterOperator operator) {
        Map<FilterOperator, CubeQuery> rv = new EnumMap<>(FilterOperator.class);
        for (FilterOperator other : operator.related()) {
            rv.put(other, swapFilter(name, value, operator, other));
        }
        return rv;
    }

    // =========================================================================
    // PIVOTS AND ORDER
    // =========================================================================

    /**
     * Returns a query where the axis is pivoted, moved (or added) after the other axes.
     */
    public CubeQuery setPivot(String name) {
        CubeQuery rv = copy();
        rv.axes.remove(name);
        rv.axes.add(name);
        rv.pivots.add(name);
        rv.dropPivotOrder();
        return rv;
    }

    public CubeQuery unsetPivot(String name) {
        CubeQuery rv = copy();
        if (rv.pivots.remove(name)) {
            rv.dropPivotOrder();
        }
        return rv;
    }

    /**
     * Returns a query sorted by a value: prefix the name with {@code -} for
     * a descending order.
     */
    public CubeQuery orderBy(String name) {
        return orderBy(name, List.of());
    }

    /**
     * Returns a query sorted by a value within a pivot column group.
     *
     * @param name the value name, optionally prefixed by {@code -}
     * @param pivotValues one value per pivoted axis; empty to sort by the row totals
     */
    public CubeQuery orderBy(String name, List<Object> pivotValues) {
        CubeQuery rv = copy();
        rv.order = QueryOrder.parse(name, pivotValues);
        return rv;
    }

    public CubeQuery noOrder() {
        CubeQuery rv = copy();
        rv.order = null;
        return rv;
    }

    // An order on a pivot column group can't survive a change of the pivots.
    private void dropPivotOrder() {
        if (order != null && order.dependsOnPivot()) {
            order = null;
        }
    }

    // =========================================================================
    // OBJECT
    // =========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CubeQuery that = (CubeQuery) o;
        return axes.equals(that.axes)
                && values.equals(that.values)
                && filterSet().equals(that.filterSet())
                && new HashSet<>(hiddenValues).equals(new HashSet<>(that.hiddenValues))
                && pivots.equals(that.pivots)
                && Objects.equals(order, that.order);
    }

    @Override
    public int hashCode() {
        return Objects.hash(axes, values, filterSet(), new HashSet<>(hiddenValues), pivots, order);
    }

    @Override
    public String toString() {
        return "CubeQuery{axes=" + axes
                + ", values=" + values
                + ", filters=" + filters
                + ", hidden=" + hiddenValues
                + ", pivots=" + pivots
                + ", order=" + order
                + "}";
    }
}
