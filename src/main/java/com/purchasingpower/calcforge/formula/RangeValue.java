package com.purchasingpower.calcforge.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Values of a range, row by row.
 */
public record RangeValue(List<List<Object>> rows) {

    public RangeValue {
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(List.copyOf(row));
        }
        rows = List.copyOf(copy);
    }

    public static RangeValue empty() {
        return new RangeValue(List.of());
    }

    public static RangeValue single(Object value) {
        return new RangeValue(List.of(List.of(value)));
    }

    /**
     * One value per row.
     */
    public static RangeValue column(List<?> values) {
        List<List<Object>> rows = new ArrayList<>(values.size());
        for (Object value : values) {
            rows.add(List.of(value));
        }
        return new RangeValue(rows);
    }

    public List<Object> flatten() {
        List<Object> values = new ArrayList<>();
        rows.forEach(values::addAll);
        return values;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    public boolean isEmpty() {
        return rows.isEmpty() || columnCount() == 0;
    }

    /**
     * One-based access; null when outside the range.
     */
    public Object get(int row, int column) {
        if (row < 1 || row > rowCount() || column < 1 || column > rows.get(row - 1).size()) {
            return null;
        }
        return rows.get(row - 1).get(column - 1);
    }
}
