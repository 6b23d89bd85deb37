package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.util.CellAddresses;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit state needed to resolve references inside one formula: the sheet that
 * unqualified references belong to, and the workbook's named ranges.
 *
 * @param defaultSheet sheet of the formula's own cell; may be null
 * @param namedRanges  upper-cased name to normalized destination
 */
public record ReferenceResolutionContext(String defaultSheet, Map<String, String> namedRanges) {

    public ReferenceResolutionContext {
        namedRanges = Map.copyOf(namedRanges);
    }

    public static ReferenceResolutionContext forSheet(String defaultSheet) {
        return new ReferenceResolutionContext(defaultSheet, Map.of());
    }

    public ReferenceResolutionContext withSheet(String sheet) {
        return new ReferenceResolutionContext(sheet, namedRanges);
    }

    public String normalize(String reference) {
        return CellAddresses.normalize(reference, defaultSheet);
    }

    public Optional<String> resolveName(String name) {
        return Optional.ofNullable(namedRanges.get(name.toUpperCase(Locale.ROOT)));
    }
}
