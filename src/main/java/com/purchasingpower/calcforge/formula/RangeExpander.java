package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.CellPosition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expands ranges into cell addresses, bounded by a single cap.
 *
 * <p>The same instance serves the classifier, the graph builder, the evaluator and the
 * TypeScript translator, so a range is either expanded or opaque for all of them.
 */
@Slf4j
public class RangeExpander {

    private final int cap;

    public RangeExpander(int cap) {
        if (cap < 1) {
            throw new IllegalArgumentException("Range expansion cap must be positive: " + cap);
        }
        this.cap = cap;
    }

    public int getCap() {
        return cap;
    }

    /**
     * Expands a normalized reference.
     *
     * @return the single address for a cell, every cell (row-major) for a range within
     *         the cap, or the range itself when it is opaque
     */
    public List<String> expand(String reference) {
        if (!CellAddresses.isRange(reference)) {
            return List.of(reference);
        }
        return grid(reference)
                .map(rows -> rows.stream().flatMap(List::stream).toList())
                .orElseGet(() -> List.of(reference));
    }

    /**
     * Cells of a range, row by row. Empty when the range is opaque: larger than the cap,
     * unbounded (whole columns), or not a range at all.
     */
    public Optional<List<List<String>>> grid(String range) {
        Optional<Bounds> bounds = bounds(range);
        if (bounds.isEmpty()) {
            return Optional.empty();
        }
        Bounds b = bounds.get();
        long size = (long) b.rows() * b.columns();
        if (size > cap) {
            log.debug("Range {} has {} cells, above the cap of {}; kept opaque", range, size, cap);
            return Optional.empty();
        }
        String sheet = CellAddresses.sheetOf(range);
        List<List<String>> rows = new ArrayList<>(b.rows());
        for (int row = b.top(); row <= b.bottom(); row++) {
            List<String> cells = new ArrayList<>(b.columns());
            for (int column = b.left(); column <= b.right(); column++) {
                String coordinate = CellAddresses.coordinate(new CellPosition(row, column));
                cells.add(sheet == null ? coordinate : sheet + "!" + coordinate);
            }
            rows.add(List.copyOf(cells));
        }
        return Optional.of(List.copyOf(rows));
    }

    public boolean isOpaque(String reference) {
        return CellAddresses.isRange(reference) && grid(reference).isEmpty();
    }

    private Optional<Bounds> bounds(String range) {
        String local = CellAddresses.localPart(range);
        int colon = local.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        Optional<CellPosition> start = CellAddresses.position(local.substring(0, colon));
        Optional<CellPosition> end = CellAddresses.position(local.substring(colon + 1));
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        CellPosition a = start.get();
        CellPosition z = end.get();
        return Optional.of(new Bounds(
                Math.min(a.row(), z.row()), Math.max(a.row(), z.row()),
                Math.min(a.column(), z.column()), Math.max(a.column(), z.column())));
    }

    private record Bounds(int top, int bottom, int left, int right) {

        int rows() {
            return bottom - top + 1;
        }

        int columns() {
            return right - left + 1;
        }
    }
}
