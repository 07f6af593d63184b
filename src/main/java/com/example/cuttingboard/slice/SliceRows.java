package com.example.cuttingboard.slice;

import com.example.cuttingboard.accumulator.Accumulator;
import com.example.cuttingboard.accumulator.Numbers;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.query.QueryOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens a slice into table rows, one per combination of its non-pivot axes.
 *
 * <p>Each row carries the sub-slice over the pivot axes and the totals of
 * its values across the pivot. Rows follow the order of the axes, unless
 * the query has an order on one of its values: rows are then sorted by the
 * row totals, or by the pivot group named by the order's pivot values.
 */
public final class SliceRows {

    /**
     * One row of a table.
     *
     * @param keys the values of the non-pivot axes
     * @param cells the sub-slice over the pivot axes
     * @param totals the values of the row summed over the pivot
     */
    public record Row(List<Object> keys, Slice cells, Map<String, Accumulator> totals) {

        public Object total(String name) {
            Accumulator acc = totals.get(name);
            return acc == null ? null : acc.get();
        }
    }

    private SliceRows() {
    }

    public static List<Row> of(Slice slice) {
        CubeQuery query = slice.query();
        int pivotDim = query.pivot().size();

        List<Row> rows = new ArrayList<>();
        collect(slice, pivotDim, new ArrayList<>(), rows);

        Optional<QueryOrder> order = query.order();
        if (order.isPresent() && query.sliceValues().contains(order.get().name())) {
            sort(rows, order.get(), pivotDim);
        }
        return Collections.unmodifiableList(rows);
    }

    private static void collect(Slice view, int pivotDim, List<Object> prefix, List<Row> rows) {
        if (view.dim() == pivotDim) {
            rows.add(new Row(Collections.unmodifiableList(new ArrayList<>(prefix)), view, totals(view)));
            return;
        }
        for (Map.Entry<Object, Slice> e : view.entries()) {
            prefix.add(e.getKey());
            collect(e.getValue(), pivotDim, prefix, rows);
            prefix.remove(prefix.size() - 1);
        }
    }

    private static Map<String, Accumulator> totals(Slice cells) {
        List<Map<String, Accumulator>> leaves = new ArrayList<>();
        SliceTrees.forEachCell(cells.data(), cells.dim(), (key, cell) -> leaves.add(cell));
        if (leaves.isEmpty()) {
            return cells.makeAcc();
        }
        Map<String, Accumulator> rv = SliceTrees.copyCell(leaves.get(0), cells.recordValues());
        for (int i = 1; i < leaves.size(); i++) {
            SliceTrees.mergeInto(rv, leaves.get(i));
        }
        return Collections.unmodifiableMap(rv);
    }

    private static void sort(List<Row> rows, QueryOrder order, int pivotDim) {
        List<Object> pivotValues = order.pivotValues();
        if (!pivotValues.isEmpty() && pivotValues.size() != pivotDim) {
            return;
        }

        Map<Row, Object> keys = new IdentityHashMap<>();
        boolean numeric = true;
        for (Row row : rows) {
            Object value = sortKey(row, order.name(), pivotValues);
            keys.put(row, value);
            numeric &= value == null || value instanceof Number;
        }

        // missing numbers count as zero, other missing values come first
        Comparator<Object> byValue = numeric
                ? Comparator.comparing((Object v) -> v == null ? 0L : v, Numbers::compare)
                : Comparator.nullsFirst(Numbers::compare);
        Comparator<Row> comparator = Comparator.comparing(keys::get, byValue);
        rows.sort(order.descending() ? comparator.reversed() : comparator);
    }

    private static Object sortKey(Row row, String name, List<Object> pivotValues) {
        if (pivotValues.isEmpty()) {
            return row.total(name);
        }
        return pivotValue(row.cells(), pivotValues, name);
    }

    private static Object pivotValue(Slice cells, List<Object> path, String name) {
        Slice view = cells;
        for (Object key : path) {
            if (!view.containsKey(key)) {
                return null;
            }
            view = view.get(key);
        }
        return view.value(name);
    }
}
