package com.purchasingpower.calcforge.service.classification;

import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.formula.ReferenceResolutionContext;
import com.purchasingpower.calcforge.formula.ValueCoercion;
import com.purchasingpower.calcforge.model.classification.DataValidation;
import com.purchasingpower.calcforge.model.classification.InputType;
import com.purchasingpower.calcforge.model.workbook.RawCell;
import com.purchasingpower.calcforge.model.workbook.RawValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns reader validation rules into {@link DataValidation}s with literal option lists
 * and the cells they cover.
 */
@Slf4j
@RequiredArgsConstructor
public class ValidationResolver {

    private final RangeExpander rangeExpander;

    /**
     * @param cells         every non-empty raw cell keyed by qualified address
     * @param defaultSheet  sheet for rules that do not name one
     * @param namedRanges   upper-cased name to normalized destination
     */
    public DataValidation resolve(RawValidation raw, Map<String, RawCell> cells, String defaultSheet,
                           Map<String, String> namedRanges) {
        String sheet = raw.getSheet() == null ? defaultSheet : raw.getSheet();
        ReferenceResolutionContext context = new ReferenceResolutionContext(sheet, namedRanges);
        InputType inputType = inputType(raw.getType());
        List<String> options = inputType == InputType.ENUM ? options(raw, cells, context) : List.of();

        return DataValidation.builder()
                .sheet(sheet)
                .type(raw.getType())
                .inputType(inputType)
                .operator(raw.getOperator())
                .formula1(raw.getFormula1())
                .formula2(raw.getFormula2())
                .allowBlank(raw.isAllowBlank())
                .options(options)
                .appliesTo(targets(raw.getRanges(), context))
                .errorMessage(raw.getErrorMessage())
                .prompt(raw.getPrompt())
                .build();
    }

    public static InputType inputType(String validationType) {
        if (validationType == null) {
            return null;
        }
        return switch (validationType.trim().toLowerCase(Locale.ROOT)) {
            case "list" -> InputType.ENUM;
            case "whole", "decimal" -> InputType.NUMBER;
            case "date" -> InputType.DATE;
            case "textlength" -> InputType.TEXT;
            default -> null;
        };
    }

    private List<String> options(RawValidation raw, Map<String, RawCell> cells, ReferenceResolutionContext context) {
        if (raw.getOptions() != null && !raw.getOptions().isEmpty()) {
            return List.copyOf(raw.getOptions());
        }
        String formula = raw.getFormula1();
        if (formula == null || formula.isBlank()) {
            return List.of();
        }
        String trimmed = formula.trim();
        String source = stripQuotes(trimmed);
        if (isQuoted(trimmed) || source.contains(",")) {
            return Arrays.stream(source.split(","))
                    .map(String::trim)
                    .filter(option -> !option.isEmpty())
                    .toList();
        }
        String reference = source.startsWith("=") ? source.substring(1).trim() : source;
        String target = context.resolveName(reference).orElseGet(() -> context.normalize(reference));
        Set<String> options = new LinkedHashSet<>();
        for (String address : rangeExpander.expand(target)) {
            RawCell cell = cells.get(address);
            if (cell != null && !cell.isEmpty() && cell.getValue() != null) {
                options.add(ValueCoercion.toText(cell.getValue()).trim());
            }
        }
        if (options.isEmpty()) {
            log.debug("List validation source {} resolved to no options", target);
        }
        return List.copyOf(options);
    }

    private List<String> targets(String ranges, ReferenceResolutionContext context) {
        if (ranges == null || ranges.isBlank()) {
            return List.of();
        }
        List<String> addresses = new ArrayList<>();
        for (String range : ranges.trim().split("\\s+")) {
            String normalized = context.normalize(range);
            if (rangeExpander.isOpaque(normalized)) {
                log.warn("Validation range {} exceeds the expansion cap and is not attached to cells", normalized);
                continue;
            }
            addresses.addAll(rangeExpander.expand(normalized));
        }
        return List.copyOf(addresses);
    }

    private static boolean isQuoted(String text) {
        return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
    }

    private static String stripQuotes(String text) {
        return isQuoted(text) ? text.substring(1, text.length() - 1) : text;
    }
}
