package com.purchasingpower.calcforge.service.logic.impl;

import com.purchasingpower.calcforge.formula.ExcelFunction;
import com.purchasingpower.calcforge.formula.FormulaDiagnostic;
import com.purchasingpower.calcforge.formula.FormulaEvaluator;
import com.purchasingpower.calcforge.formula.FormulaParser;
import com.purchasingpower.calcforge.formula.RangeExpander;
import com.purchasingpower.calcforge.formula.ReferenceResolutionContext;
import com.purchasingpower.calcforge.formula.TranslationResult;
import com.purchasingpower.calcforge.formula.TypeInference;
import com.purchasingpower.calcforge.formula.TypeInferencer;
import com.purchasingpower.calcforge.formula.TypeScriptTranslator;
import com.purchasingpower.calcforge.formula.ast.BinaryNode;
import com.purchasingpower.calcforge.formula.ast.ErrorNode;
import com.purchasingpower.calcforge.formula.ast.FormulaNode;
import com.purchasingpower.calcforge.formula.ast.FunctionNode;
import com.purchasingpower.calcforge.formula.ast.UnaryNode;
import com.purchasingpower.calcforge.model.graph.CalculationCluster;
import com.purchasingpower.calcforge.model.graph.CircularRef;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.graph.GraphNode;
import com.purchasingpower.calcforge.model.graph.SemanticPurpose;
import com.purchasingpower.calcforge.model.logic.*;
import com.purchasingpower.calcforge.service.logic.CalculationScriptWriter;
import com.purchasingpower.calcforge.service.logic.LogicExtractor;
import com.purchasingpower.calcforge.service.logic.TestCaseSynthesizer;
import com.purchasingpower.calcforge.util.TypeScriptLiterals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
public class LogicExtractorImpl implements LogicExtractor {

    private static final List<String> BUSINESS_KEYWORDS = List.of("TAX", "DISCOUNT", "RATE", "MARGIN", "TOTAL", "PROFIT");

    private final FormulaParser formulaParser;
    private final TypeInferencer typeInferencer;
    private final TypeScriptTranslator translator;
    private final RangeExpander rangeExpander;
    private final TestCaseSynthesizer testCaseSynthesizer;

    public LogicExtractorImpl(FormulaParser formulaParser, TypeInferencer typeInferencer,
                              TypeScriptTranslator translator, FormulaEvaluator evaluator,
                              RangeExpander rangeExpander) {
        this.formulaParser = formulaParser;
        this.typeInferencer = typeInferencer;
        this.translator = translator;
        this.rangeExpander = rangeExpander;
        this.testCaseSynthesizer = new TestCaseSynthesizer(evaluator);
    }

    @Override
    public LogicExtractionResult extract(DependencyGraph graph) {
        // Step 1: parse every formula once
        Map<String, ParsedFormula> parsed = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes().values()) {
            if (node.hasFormula()) {
                ReferenceResolutionContext context = new ReferenceResolutionContext(node.getSheet(), graph.getNamedRanges());
                parsed.put(node.getAddress(), formulaParser.parse(node.getAddress(), node.getFormula(), context));
            }
        }

        // Step 2: features that cannot become static code
        List<UnsupportedFeature> unsupported = new ArrayList<>();
        parsed.values().forEach(formula -> unsupported.addAll(scan(formula)));
        for (CircularRef cycle : graph.getCircularRefs()) {
            unsupported.add(circularFeature(cycle, graph));
        }

        // Step 3: one calculation and one business rule per cluster
        List<CalculationUnit> calculations = new ArrayList<>();
        List<BusinessRule> rules = new ArrayList<>();
        List<TestCase> testSuite = new ArrayList<>();
        if (graph.getClusters().isEmpty()) {
            parsed.values().forEach(formula -> calculations.add(unit(formula.getTarget(), List.of(formula), List.of(formula.getTarget()))));
        }
        Map<String, Integer> orderIndex = new HashMap<>();
        for (int i = 0; i < graph.getExecutionOrder().size(); i++) {
            orderIndex.put(graph.getExecutionOrder().get(i), i);
        }
        for (CalculationCluster cluster : graph.getClusters()) {
            List<ParsedFormula> formulas = cluster.getNodes().stream()
                    .filter(parsed::containsKey)
                    .sorted(Comparator.comparingInt((String address) -> orderIndex.getOrDefault(address, Integer.MAX_VALUE))
                            .thenComparing(Comparator.naturalOrder()))
                    .map(parsed::get)
                    .toList();
            List<String> outputs = cluster.getOutputs().isEmpty()
                    ? formulas.stream().map(ParsedFormula::getTarget).toList()
                    : cluster.getOutputs();
            CalculationUnit unit = unit(cluster.getId(), formulas, outputs);
            calculations.add(unit);

            BusinessRule rule = rule(cluster, unit, graph);
            rules.add(rule);
            testSuite.addAll(rule.getTestCases());
        }

        LogicExtractionResult result = LogicExtractionResult.builder()
                .businessRules(List.copyOf(rules))
                .calculations(List.copyOf(calculations))
                .unsupportedFeatures(List.copyOf(unsupported))
                .testSuite(List.copyOf(testSuite))
                .build();
        log.info("Extracted {} business rules ({} executable), {} unsupported features, {} test cases",
                rules.size(), rules.stream().filter(BusinessRule::isExecutable).count(),
                unsupported.size(), testSuite.size());
        return result;
    }

    private CalculationUnit unit(String id, List<ParsedFormula> formulas, List<String> outputs) {
        Set<String> targets = formulas.stream().map(ParsedFormula::getTarget).collect(Collectors.toSet());
        Set<String> inputs = new TreeSet<>();
        for (ParsedFormula formula : formulas) {
            formula.getReferences().stream().filter(reference -> !targets.contains(reference)).forEach(inputs::add);
        }
        return CalculationUnit.builder()
                .id(id)
                .formulas(formulas)
                .inputs(List.copyOf(inputs))
                .outputs(List.copyOf(outputs))
                .pseudocode(formulas.stream().map(formula -> formula.getTarget() + " = " + formula.getRaw().trim()).toList())
                .build();
    }

    private BusinessRule rule(CalculationCluster cluster, CalculationUnit unit, DependencyGraph graph) {
        List<ParsedFormula> formulas = unit.getFormulas();
        TypeInference types = typeInferencer.infer(formulas);
        List<String> fieldInputs = unit.getInputs().stream().filter(address -> !rangeExpander.isOpaque(address)).toList();

        List<String> constraints = new ArrayList<>();
        boolean blocked = false;
        for (ParsedFormula formula : formulas) {
            for (String function : formula.getFunctions()) {
                if (!ExcelFunction.isSupported(function)) {
                    addOnce(constraints, "Unsupported function: " + function);
                    blocked = true;
                }
            }
            if (isMalformed(formula)) {
                constraints.add("Malformed formula in " + formula.getTarget() + ": " + malformedDetail(formula));
                blocked = true;
            }
        }
        Optional<CircularRef> cycle = graph.getCircularRefs().stream()
                .filter(ref -> cluster.getNodes().stream().anyMatch(ref::involves))
                .findFirst();
        if (cycle.isPresent()) {
            constraints.add("Circular reference among: " + String.join(", ", cycle.get().getCells()));
            blocked = true;
        }

        List<CalculationScriptWriter.Assignment> assignments = new ArrayList<>();
        if (!blocked) {
            for (ParsedFormula formula : formulas) {
                TranslationResult translation = translator.translate(formula.getAst());
                if (!translation.isSupported()) {
                    constraints.add(formula.getTarget() + ": " + translation.getProblems().get(0));
                    blocked = true;
                    break;
                }
                translation.getProblems().forEach(problem -> constraints.add(formula.getTarget() + ": " + problem));
                assignments.add(new CalculationScriptWriter.Assignment(formula.getTarget(), formula.getRaw().trim(),
                        translation.getExpression()));
            }
        }
        boolean executable = !blocked && constraints.isEmpty();

        String typescript = blocked
                ? CalculationScriptWriter.stub(cluster.getId(), constraints)
                : CalculationScriptWriter.function(cluster.getId(), assignments);
        if (blocked) {
            log.warn("Calculation {} compiled to a runtime-error stub: {}", cluster.getId(), constraints);
        } else if (!executable) {
            log.warn("Calculation {} reads ranges that fail at runtime: {}", cluster.getId(), constraints);
        }

        List<TestCase> testCases = executable
                ? testCaseSynthesizer.synthesize(cluster.getId(), fieldInputs, formulas)
                : List.of();

        return BusinessRule.builder()
                .id(cluster.getId())
                .name(ruleName(cluster))
                .description(description(cluster, formulas))
                .inputs(fieldInputs.stream().map(address -> new RuleField(address, types.referenceType(address))).toList())
                .outputs(unit.getOutputs().stream().map(address -> new RuleField(address, types.outputType(address))).toList())
                .logic(LogicRepresentation.builder()
                        .pseudocode(String.join("\n", unit.getPseudocode()))
                        .typescript(typescript)
                        .validationSchema(validationSchema(fieldInputs, types))
                        .build())
                .constraints(List.copyOf(constraints))
                .testCases(testCases)
                .executable(executable)
                .build();
    }

    private List<UnsupportedFeature> scan(ParsedFormula formula) {
        List<UnsupportedFeature> features = new ArrayList<>();
        for (String function : formula.getFunctions()) {
            if (ExcelFunction.isDynamicReference(function)) {
                features.add(UnsupportedFeature.builder()
                        .kind(FeatureKind.DYNAMIC_REFERENCE)
                        .cellAddress(formula.getTarget())
                        .formula(formula.getRaw())
                        .detail(function)
                        .explanation(function + " creates runtime references that cannot be safely converted to static code.")
                        .suggestedFix("Replace dynamic references with explicit ranges, "
                                + "or restructure data to avoid runtime cell selection.")
                        .build());
            } else if (!ExcelFunction.isSupported(function)) {
                features.add(UnsupportedFeature.builder()
                        .kind(FeatureKind.UNSUPPORTED_FUNCTION)
                        .cellAddress(formula.getTarget())
                        .formula(formula.getRaw())
                        .detail(function)
                        .explanation(function + " is not in the supported function set and would be mis-evaluated.")
                        .suggestedFix("Rewrite the formula with supported functions or implement the calculation by hand.")
                        .build());
            }
        }
        if (isMalformed(formula)) {
            features.add(UnsupportedFeature.builder()
                    .kind(FeatureKind.MALFORMED_FORMULA)
                    .cellAddress(formula.getTarget())
                    .formula(formula.getRaw())
                    .detail(malformedDetail(formula))
                    .explanation("The formula could not be parsed completely; unreadable parts evaluate to 0.")
                    .suggestedFix("Check the formula syntax in the workbook.")
                    .build());
        }
        if (!features.isEmpty()) {
            log.debug("Formula at {} has {} unsupported features", formula.getTarget(), features.size());
        }
        return features;
    }

    private static UnsupportedFeature circularFeature(CircularRef cycle, DependencyGraph graph) {
        String first = cycle.getCells().get(0);
        return UnsupportedFeature.builder()
                .kind(FeatureKind.CIRCULAR_REFERENCE)
                .cellAddress(first)
                .formula(graph.node(first).map(GraphNode::getFormula).orElse(null))
                .detail(String.join(", ", cycle.getCells()))
                .explanation("These cells depend on each other and have no valid evaluation order.")
                .suggestedFix("Break the cycle, or replace iterative calculation with an explicit closed form.")
                .build();
    }

    private static boolean isMalformed(ParsedFormula formula) {
        return !formula.isClean() || containsError(formula.getAst());
    }

    private static String malformedDetail(ParsedFormula formula) {
        return formula.getDiagnostics().stream()
                .map(FormulaDiagnostic::message)
                .findFirst()
                .orElse("formula contains an error value");
    }

    private static boolean containsError(FormulaNode node) {
        if (node instanceof ErrorNode) {
            return true;
        }
        if (node instanceof UnaryNode unary) {
            return containsError(unary.operand());
        }
        if (node instanceof BinaryNode binary) {
            return containsError(binary.left()) || containsError(binary.right());
        }
        if (node instanceof FunctionNode function) {
            return function.args().stream().anyMatch(LogicExtractorImpl::containsError);
        }
        return false;
    }

    /**
     * "Aggregation - Total Cost", or just the label when no purpose was detected.
     */
    private static String ruleName(CalculationCluster cluster) {
        String base = cluster.getLabel() != null
                ? cluster.getLabel().trim().replaceAll(":+$", "").trim()
                : cluster.getId().replace("cluster_", "Calculation ").trim();
        SemanticPurpose purpose = cluster.getSemanticPurpose();
        return purpose == null ? base : purpose.getTitle() + " - " + base;
    }

    private static String description(CalculationCluster cluster, List<ParsedFormula> formulas) {
        if (cluster.getSemanticPurpose() == null) {
            return "Auto-extracted calculation cluster";
        }
        StringBuilder text = new StringBuilder(Objects.toString(cluster.getLabel(), "").toUpperCase(Locale.ROOT));
        formulas.forEach(formula -> text.append(' ').append(formula.getRaw().toUpperCase(Locale.ROOT)));
        String keywords = BUSINESS_KEYWORDS.stream()
                .filter(keyword -> text.indexOf(keyword) >= 0)
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        String purpose = cluster.getSemanticPurpose().getKey();
        return keywords.isEmpty()
                ? "Auto-extracted " + purpose + " calculation cluster"
                : "Auto-extracted " + purpose + " cluster (" + keywords + ")";
    }

    private static String validationSchema(List<String> inputs, TypeInference types) {
        return inputs.stream()
                .map(address -> TypeScriptLiterals.string(address) + ": " + zodType(types.referenceType(address)))
                .collect(Collectors.joining(", ", "z.object({", "})"));
    }

    private static String zodType(ValueType type) {
        return switch (type) {
            case NUMBER -> "z.number()";
            case TEXT -> "z.string()";
            case BOOLEAN -> "z.boolean()";
            case DATE -> "z.union([z.number(), z.string()])";
            case UNKNOWN -> "z.any()";
        };
    }

    private static void addOnce(List<String> items, String item) {
        if (!items.contains(item)) {
            items.add(item);
        }
    }
}
