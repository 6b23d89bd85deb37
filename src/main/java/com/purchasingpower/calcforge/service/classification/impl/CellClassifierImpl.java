package com.purchasingpower.calcforge.service.classification.impl;

import com.purchasingpower.calcforge.configuration.CalcForgeProperties;
import com.purchasingpower.calcforge.exception.WorkbookReadException;
import com.purchasingpower.calcforge.formula.FormulaParser;
import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.formula.ReferenceResolutionContext;
import com.purchasingpower.calcforge.model.classification.*;
import com.purchasingpower.calcforge.model.workbook.*;
import com.purchasingpower.calcforge.service.classification.CellClassifier;
import com.purchasingpower.calcforge.service.classification.RowProfile;
import com.purchasingpower.calcforge.service.classification.StructuralHeuristics;
import com.purchasingpower.calcforge.service.classification.ValidationResolver;
import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.CellPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

@Slf4j
@Service
public class CellClassifierImpl implements CellClassifier {

    private final FormulaParser formulaParser;
    private final RangeExpander rangeExpander;
    private final StructuralHeuristics heuristics;
    private final ValidationResolver validationResolver;

    public CellClassifierImpl(CalcForgeProperties properties, FormulaParser formulaParser, RangeExpander rangeExpander) {
        this.formulaParser = formulaParser;
        this.rangeExpander = rangeExpander;
        this.heuristics = new StructuralHeuristics(properties.getClassification());
        this.validationResolver = new ValidationResolver(rangeExpander);
    }

    @Override
    public CellClassificationResult classify(WorkbookStructure workbook) {
        if (workbook == null || workbook.getSheets() == null || workbook.getSheets().isEmpty()) {
            throw new WorkbookReadException("Workbook has no sheets", workbook == null ? null : workbook.getFileName());
        }
        String firstSheet = workbook.getSheets().get(0).getName();
        Map<String, String> namedRanges = resolveNamedRanges(workbook.getNamedRanges(), firstSheet);

        Map<String, RawCell> rawCells = new LinkedHashMap<>();
        Map<String, List<Located>> cellsBySheet = new LinkedHashMap<>();
        for (SheetData sheet : workbook.getSheets()) {
            cellsBySheet.put(sheet.getName(), locate(sheet, rawCells));
        }

        Map<String, List<String>> references = new HashMap<>();
        Map<String, Set<String>> referencedBy = new HashMap<>();
        for (SheetData sheet : workbook.getSheets()) {
            ReferenceResolutionContext context = new ReferenceResolutionContext(sheet.getName(), namedRanges);
            for (Located located : cellsBySheet.get(sheet.getName())) {
                if (!located.raw().hasFormula()) {
                    continue;
                }
                List<String> refs = extractReferences(located.raw().getFormula(), context);
                references.put(located.address(), refs);
                for (String ref : refs) {
                    referencedBy.computeIfAbsent(ref, key -> new TreeSet<>()).add(located.address());
                }
            }
        }

        List<DataValidation> validations = new ArrayList<>();
        Map<String, DataValidation> validationByCell = new HashMap<>();
        for (RawValidation raw : workbook.getDataValidations()) {
            DataValidation validation = validationResolver.resolve(raw, rawCells, firstSheet, namedRanges);
            validations.add(validation);
            validation.getAppliesTo().forEach(address -> validationByCell.putIfAbsent(address, validation));
        }

        List<SheetClassification> sheets = new ArrayList<>();
        for (SheetData sheet : workbook.getSheets()) {
            sheets.add(classifySheet(sheet, cellsBySheet.get(sheet.getName()), references, referencedBy, validationByCell));
        }

        CellClassificationResult result = CellClassificationResult.builder()
                .workbookName(workbook.getFileName())
                .sheets(List.copyOf(sheets))
                .namedRanges(Collections.unmodifiableMap(namedRanges))
                .macros(List.copyOf(workbook.getMacros()))
                .validations(List.copyOf(validations))
                .conditionalFormats(conditionalFormats(workbook.getConditionalFormats(), firstSheet))
                .pivotTables(List.copyOf(workbook.getPivotTables()))
                .build();

        logSummary(result);
        return result;
    }

    private SheetClassification classifySheet(SheetData sheet, List<Located> cells, Map<String, List<String>> references,
                                              Map<String, Set<String>> referencedBy,
                                              Map<String, DataValidation> validationByCell) {
        Map<CellPosition, CellRole> roles = new HashMap<>();
        Map<Integer, RowProfile> rows = new HashMap<>();
        for (Located cell : cells) {
            roles.put(cell.position(), baseRole(cell, referencedBy));
            rows.merge(cell.position().row(), RowProfile.EMPTY.add(cell.raw().getValue(), cell.raw().hasFormula()),
                    (current, added) -> current.add(cell.raw().getValue(), cell.raw().hasFormula()));
        }
        int maxNonEmpty = rows.values().stream().mapToInt(RowProfile::nonEmpty).max().orElse(0);
        Set<CellPosition> mergedAnchors = mergedAnchors(sheet.getMergedRanges());

        for (Located cell : cells) {
            if (roles.get(cell.position()) != CellRole.STATIC || !isText(cell.raw())) {
                continue;
            }
            String text = cell.raw().getValue().toString();
            boolean structural = heuristics.isStructural(text, cell.raw().isBold(),
                    mergedAnchors.contains(cell.position()), rows.get(cell.position().row()), maxNonEmpty);
            if (structural) {
                roles.put(cell.position(), CellRole.STRUCTURAL);
            }
        }
        for (Located cell : cells) {
            if (roles.get(cell.position()) == CellRole.STATIC && isText(cell.raw()) && besideCalculation(cell.position(), roles)) {
                roles.put(cell.position(), CellRole.LABEL);
            }
        }

        List<ClassifiedCell> classified = new ArrayList<>(cells.size());
        int maxRow = 0;
        int maxColumn = 0;
        for (Located cell : cells) {
            CellRole role = roles.get(cell.position());
            RawCell raw = cell.raw();
            DataValidation validation = validationByCell.get(cell.address());
            maxRow = Math.max(maxRow, cell.position().row());
            maxColumn = Math.max(maxColumn, cell.position().column());
            classified.add(ClassifiedCell.builder()
                    .address(cell.address())
                    .sheet(sheet.getName())
                    .row(cell.position().row())
                    .column(cell.position().column())
                    .role(role)
                    .formula(raw.hasFormula() ? raw.getFormula().trim() : null)
                    .value(raw.getValue())
                    .inputType(inputType(raw, validation))
                    .formatting(CellFormatting.builder()
                            .numberFormat(raw.getNumberFormat())
                            .bold(raw.isBold())
                            .italic(raw.isItalic())
                            .fontColor(raw.getFontColor())
                            .fillColor(raw.getFillColor())
                            .build())
                    .validation(validation)
                    .label(role.isText() ? raw.getValue().toString().trim() : null)
                    .references(references.getOrDefault(cell.address(), List.of()))
                    .referencedBy(List.copyOf(referencedBy.getOrDefault(cell.address(), Set.of())))
                    .build());
        }

        List<SheetSection> sections = sections(classified, maxRow);
        return SheetClassification.builder()
                .name(sheet.getName())
                .cells(List.copyOf(classified))
                .sections(sections)
                .inputGroups(inputGroups(sheet.getName(), classified))
                .outputGroups(outputGroups(sheet.getName(), classified, sections))
                .maxRow(maxRow)
                .maxColumn(maxColumn)
                .build();
    }

    private static CellRole baseRole(Located cell, Map<String, Set<String>> referencedBy) {
        boolean referenced = !referencedBy.getOrDefault(cell.address(), Set.of()).isEmpty();
        if (cell.raw().hasFormula()) {
            return referenced ? CellRole.FORMULA_INTERMEDIATE : CellRole.FORMULA_OUTPUT;
        }
        return referenced ? CellRole.INPUT : CellRole.STATIC;
    }

    /**
     * References named by the formula, ranges expanded up to the cap. Sorted.
     */
    private List<String> extractReferences(String formula, ReferenceResolutionContext context) {
        Set<String> expanded = new TreeSet<>();
        for (String reference : formulaParser.referenceTokens(formula, context)) {
            expanded.addAll(rangeExpander.expand(reference));
        }
        return List.copyOf(expanded);
    }

    private static boolean besideCalculation(CellPosition position, Map<CellPosition, CellRole> roles) {
        for (CellPosition neighbour : List.of(position.left(), position.right(), position.above(), position.below())) {
            CellRole role = roles.get(neighbour);
            if (role != null && role.isCalculation()) {
                return true;
            }
        }
        return false;
    }

    private static boolean isText(RawCell raw) {
        return !raw.hasFormula() && raw.getValue() instanceof String text && !text.isBlank();
    }

    private static InputType inputType(RawCell raw, DataValidation validation) {
        if (validation != null && validation.getInputType() != null) {
            return validation.getInputType();
        }
        Object value = raw.getValue();
        if (raw.getDataType() == CellDataType.DATE) {
            return InputType.DATE;
        }
        if (value instanceof Boolean || raw.getDataType() == CellDataType.BOOLEAN) {
            return InputType.BOOLEAN;
        }
        String format = raw.getNumberFormat() == null ? "" : raw.getNumberFormat();
        boolean numeric = value instanceof Number || raw.getDataType() == CellDataType.NUMBER
                || (raw.hasFormula() && !format.isEmpty() && !format.equalsIgnoreCase("General") && !format.equals("@"));
        if (!numeric) {
            return InputType.TEXT;
        }
        if (format.contains("%")) {
            return InputType.PERCENTAGE;
        }
        if (format.contains("$") || format.contains("€") || format.contains("£")) {
            return InputType.CURRENCY;
        }
        return InputType.NUMBER;
    }

    private static List<SheetSection> sections(List<ClassifiedCell> cells, int maxRow) {
        TreeMap<Integer, ClassifiedCell> headings = new TreeMap<>();
        for (ClassifiedCell cell : cells) {
            if (cell.getRole() == CellRole.STRUCTURAL) {
                headings.putIfAbsent(cell.getRow(), cell);
            }
        }
        List<SheetSection> sections = new ArrayList<>();
        for (Map.Entry<Integer, ClassifiedCell> heading : headings.entrySet()) {
            Integer next = headings.higherKey(heading.getKey());
            int end = next == null ? maxRow : next - 1;
            sections.add(new SheetSection(heading.getValue().getLabel(), heading.getValue().getAddress(),
                    heading.getKey() + 1, end));
        }
        return List.copyOf(sections);
    }

    private static List<CellGroup> inputGroups(String sheet, List<ClassifiedCell> cells) {
        List<String> inputs = cells.stream()
                .filter(cell -> cell.getRole() == CellRole.INPUT)
                .map(ClassifiedCell::getAddress)
                .toList();
        if (inputs.isEmpty()) {
            return List.of();
        }
        return List.of(new CellGroup(sheet + " - General Inputs", sheet, "General", inputs));
    }

    private static List<CellGroup> outputGroups(String sheet, List<ClassifiedCell> cells, List<SheetSection> sections) {
        Map<String, List<String>> bySection = new LinkedHashMap<>();
        for (ClassifiedCell cell : cells) {
            if (cell.getRole() != CellRole.FORMULA_OUTPUT) {
                continue;
            }
            String section = sections.stream()
                    .filter(candidate -> candidate.contains(cell.getRow()))
                    .map(SheetSection::getTitle)
                    .findFirst()
                    .orElse("General");
            bySection.computeIfAbsent(section, key -> new ArrayList<>()).add(cell.getAddress());
        }
        List<CellGroup> groups = new ArrayList<>();
        bySection.forEach((section, outputs) ->
                groups.add(new CellGroup(sheet + " - " + section + " Outputs", sheet, section, List.copyOf(outputs))));
        return List.copyOf(groups);
    }

    private Map<String, String> resolveNamedRanges(List<NamedRange> namedRanges, String defaultSheet) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (NamedRange namedRange : namedRanges) {
            if (namedRange.getName() == null || namedRange.getReference() == null) {
                log.warn("Skipping incomplete named range: {}", namedRange);
                continue;
            }
            String reference = namedRange.getReference().trim();
            if (reference.startsWith("=")) {
                reference = reference.substring(1);
            }
            resolved.put(namedRange.getName().toUpperCase(Locale.ROOT), CellAddresses.normalize(reference, defaultSheet));
        }
        return resolved;
    }

    private static List<ConditionalFormat> conditionalFormats(List<RawConditionalFormat> rules, String defaultSheet) {
        List<ConditionalFormat> formats = new ArrayList<>();
        for (RawConditionalFormat rule : rules) {
            String sheet = rule.getSheet() == null ? defaultSheet : rule.getSheet();
            String description = (Objects.toString(rule.getType(), "") + ":" + Objects.toString(rule.getFormula(), ""))
                    .replaceAll("^:+|:+$", "");
            AlertSeverity severity = AlertSeverity.fromValue(rule.getSeverity());
            formats.add(ConditionalFormat.builder()
                    .sheet(sheet)
                    .range(rule.getRange() == null ? null : CellAddresses.normalize(rule.getRange(), sheet))
                    .rule(description)
                    .color(rule.getColor())
                    .severity(severity != null ? severity : AlertSeverity.fromColor(rule.getColor()))
                    .build());
        }
        return List.copyOf(formats);
    }

    private static Set<CellPosition> mergedAnchors(List<String> mergedRanges) {
        Set<CellPosition> anchors = new HashSet<>();
        for (String range : mergedRanges) {
            String local = CellAddresses.localPart(range);
            String first = local.contains(":") ? local.substring(0, local.indexOf(':')) : local;
            CellAddresses.position(first).ifPresent(anchors::add);
        }
        return anchors;
    }

    /**
     * Non-empty cells of a sheet in row-major order.
     */
    private List<Located> locate(SheetData sheet, Map<String, RawCell> rawCells) {
        Map<CellPosition, Located> located = new HashMap<>();
        for (RawCell raw : sheet.getCells()) {
            if (raw.isEmpty()) {
                continue;
            }
            Optional<CellPosition> position = raw.getCoordinate() == null
                    ? Optional.empty()
                    : CellAddresses.position(raw.getCoordinate());
            if (position.isEmpty()) {
                log.warn("Skipping cell with invalid coordinate '{}' on sheet {}", raw.getCoordinate(), sheet.getName());
                continue;
            }
            String address = CellAddresses.qualify(sheet.getName(), position.get());
            located.put(position.get(), new Located(address, position.get(), raw));
            rawCells.put(address, raw);
        }
        return located.values().stream()
                .sorted(Comparator.comparingInt((Located cell) -> cell.position().row())
                        .thenComparingInt(cell -> cell.position().column()))
                .toList();
    }

    private void logSummary(CellClassificationResult result) {
        Map<CellRole, Long> counts = new EnumMap<>(CellRole.class);
        result.allCells().forEach(cell -> counts.merge(cell.getRole(), 1L, Long::sum));
        log.info("Classified {} cells across {} sheets: {}", result.allCells().size(), result.getSheets().size(), counts);
    }

    private record Located(String address, CellPosition position, RawCell raw) {
    }
}
