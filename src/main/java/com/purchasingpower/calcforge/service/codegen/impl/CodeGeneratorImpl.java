package com.purchasingpower.calcforge.service.codegen.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.calcforge.configuration.CalcForgeProperties;
import com.purchasingpower.calcforge.configuration.GenerationProperties;
import com.purchasingpower.calcforge.exception.TemplateRenderingException;
import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.model.codegen.DashboardLayout;
import com.purchasingpower.calcforge.model.codegen.FieldDefinition;
import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.model.logic.BusinessRule;
import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.model.logic.RuleField;
import com.purchasingpower.calcforge.model.logic.UnsupportedFeature;
import com.purchasingpower.calcforge.service.codegen.CodeGenerationRequest;
import com.purchasingpower.calcforge.service.codegen.CodeGenerator;
import com.purchasingpower.calcforge.service.codegen.DashboardLayoutBuilder;
import com.purchasingpower.calcforge.service.codegen.FieldCatalog;
import com.purchasingpower.calcforge.service.codegen.TemplateRenderer;
import com.purchasingpower.calcforge.service.logic.CalculationScriptWriter;
import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.TypeScriptLiterals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Renders the generated Next.js application.
 *
 * <p>Source files with workbook content come from Mustache templates; the runtime
 * library, API routes and components are static resources copied verbatim. JSON
 * embedded in TypeScript is written with Jackson.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CodeGeneratorImpl implements CodeGenerator {

    static final String CALCULATIONS_DIR = "src/lib/calculations/";

    /**
     * Project path to static resource name. Dot-files are stored without the dot.
     */
    private static final Map<String, String> STATIC_FILES = staticFiles();

    private final TemplateRenderer templateRenderer;
    private final CalcForgeProperties properties;

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public GeneratedProject generate(CodeGenerationRequest request) {
        CellClassificationResult classification = request.getClassification();
        DependencyGraph graph = request.getGraph();
        LogicExtractionResult logic = request.getLogic();
        GenerationProperties generation = properties.getGeneration();

        FieldCatalog fields = new FieldCatalog(classification, graph, logic);
        List<BusinessRule> rules = DashboardLayoutBuilder.inExecutionOrder(graph, logic);
        String workbookName = Objects.toString(classification.getWorkbookName(), "workbook");

        Map<String, String> files = new TreeMap<>();
        STATIC_FILES.forEach((path, resource) -> files.put(path, templateRenderer.copy(resource)));

        // Step 1: one module per calculation plus the index
        List<Map<String, Object>> modules = new ArrayList<>();
        for (BusinessRule rule : rules) {
            String module = CellAddresses.toIdentifier(rule.getId());
            files.put(CALCULATIONS_DIR + module + ".ts", templateRenderer.render("calculation-module.ts",
                    Map.of("calculationId", rule.getId(), "typescript", rule.getLogic().getTypescript())));
            modules.add(Map.of(
                    "module", module,
                    "functionName", CalculationScriptWriter.functionName(rule.getId()),
                    "idLiteral", TypeScriptLiterals.string(rule.getId())));
        }
        files.put(CALCULATIONS_DIR + "index.ts", templateRenderer.render("calculations-index.ts", Map.of(
                "calculations", modules,
                "executionOrderJson", json(rules.stream().map(BusinessRule::getId).toList()))));

        // Step 2: field metadata, schemas and dashboard layout
        files.put("src/lib/inputs.ts", templateRenderer.render("inputs.ts", Map.of(
                "inputFieldsJson", json(fields.getInputFields()),
                "outputFieldsJson", json(fields.getOutputFields()),
                "calculationsJson", json(rules.stream().map(CodeGeneratorImpl::calculationMeta).toList()),
                "unsupportedJson", json(logic.getUnsupportedFeatures().stream().map(CodeGeneratorImpl::featureMeta).toList()),
                "inputSchema", schemaEntries(fields.getInputFields(), true),
                "outputSchema", schemaEntries(fields.getOutputFields(), false))));
        DashboardLayout layout = DashboardLayoutBuilder.build(classification, graph, logic, fields);
        files.put("src/lib/uiDesigner.ts", templateRenderer.render("ui-designer.ts", Map.of("layoutJson", json(layout))));

        // Step 3: persistence, tests and project metadata
        String schema = templateRenderer.render("schema.prisma", Map.of("columns", fields.allFields().stream()
                .map(field -> Map.of("name", field.getColumnName(), "type", field.getType().getPrismaType()))
                .toList()));
        files.put("prisma/schema.prisma", schema);
        files.put("__tests__/calculations.test.ts", templateRenderer.render("calculations.test.ts", Map.of(
                "casesJson", json(logic.getTestSuite()),
                "skipped", rules.stream()
                        .filter(rule -> !rule.isExecutable())
                        .map(rule -> Map.of("title", TypeScriptLiterals.string(
                                rule.getId() + ": " + String.join("; ", rule.getConstraints()))))
                        .toList())));
        files.put("src/app/layout.tsx", templateRenderer.render("layout.tsx", Map.of(
                "titleLiteral", TypeScriptLiterals.string(workbookName),
                "descriptionLiteral", TypeScriptLiterals.string("Calculations generated from " + workbookName))));
        files.put("README.md", templateRenderer.render("README.md", readme(generation, workbookName, rules, logic, fields)));

        Map<String, String> dependencies = new TreeMap<>(generation.getDependencies());
        Map<String, String> devDependencies = new TreeMap<>(generation.getDevDependencies());
        files.put("package.json", packageJson(generation.getProjectName(), dependencies, devDependencies));

        GeneratedProject project = GeneratedProject.builder()
                .projectName(generation.getProjectName())
                .files(Collections.unmodifiableMap(files))
                .dependencies(Collections.unmodifiableMap(dependencies))
                .devDependencies(Collections.unmodifiableMap(devDependencies))
                .relationalSchema(schema)
                .testSuite(logic.getTestSuite())
                .inputFields(fields.getInputFields())
                .outputFields(fields.getOutputFields())
                .build();

        log.info("✅ Generated {} files: {} calculations, {} input fields, {} output fields",
                files.size(), rules.size(), fields.getInputFields().size(), fields.getOutputFields().size());
        return project;
    }

    private static Map<String, Object> calculationMeta(BusinessRule rule) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("id", rule.getId());
        meta.put("name", rule.getName());
        meta.put("description", rule.getDescription());
        meta.put("executable", rule.isExecutable());
        meta.put("constraints", rule.getConstraints());
        meta.put("inputs", rule.getInputs().stream().map(RuleField::getAddress).toList());
        meta.put("outputs", rule.getOutputs().stream().map(RuleField::getAddress).toList());
        return meta;
    }

    private static Map<String, Object> featureMeta(UnsupportedFeature feature) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("kind", feature.getKind().getValue());
        meta.put("cell", feature.getCellAddress());
        meta.put("detail", feature.getDetail());
        meta.put("explanation", feature.getExplanation());
        meta.put("suggestedFix", feature.getSuggestedFix());
        return meta;
    }

    private static List<Map<String, String>> schemaEntries(List<FieldDefinition> fields, boolean input) {
        return fields.stream()
                .map(field -> Map.of(
                        "key", TypeScriptLiterals.string(field.getAddress()),
                        "zod", (input ? inputZod(field) : outputZod(field)) + ".optional()"))
                .toList();
    }

    private static String inputZod(FieldDefinition field) {
        return switch (field.getType()) {
            case NUMBER, CURRENCY, PERCENTAGE -> "z.coerce.number()";
            case TEXT -> "z.string()";
            case BOOLEAN -> "z.coerce.boolean()";
            case DATE -> "z.union([z.number(), z.string()])";
            case ENUM -> field.getOptions().stream()
                    .map(TypeScriptLiterals::string)
                    .collect(Collectors.joining(", ", "z.enum([", "])"));
            case UNKNOWN -> "z.union([z.number(), z.string(), z.boolean()])";
        };
    }

    private static String outputZod(FieldDefinition field) {
        return switch (field.getType()) {
            case NUMBER, CURRENCY, PERCENTAGE, DATE -> "z.number()";
            case TEXT, ENUM -> "z.string()";
            case BOOLEAN -> "z.boolean()";
            case UNKNOWN -> "z.any()";
        };
    }

    private static Map<String, Object> readme(GenerationProperties generation, String workbookName,
                                              List<BusinessRule> rules, LogicExtractionResult logic,
                                              FieldCatalog fields) {
        Map<String, Object> context = new HashMap<>();
        context.put("projectName", generation.getProjectName());
        context.put("workbookName", workbookName);
        context.put("inputCount", fields.getInputFields().size());
        context.put("outputCount", fields.getOutputFields().size());
        context.put("calculations", rules.stream()
                .map(rule -> Map.of(
                        "id", rule.getId(),
                        "name", rule.getName(),
                        "status", rule.isExecutable() ? "executable" : "needs review",
                        "constraints", rule.getConstraints(),
                        "hasConstraints", !rule.getConstraints().isEmpty()))
                .toList());
        context.put("unsupported", logic.getUnsupportedFeatures().stream()
                .map(CodeGeneratorImpl::featureMeta)
                .toList());
        context.put("hasUnsupported", !logic.getUnsupportedFeatures().isEmpty());
        return context;
    }

    private String packageJson(String name, Map<String, String> dependencies, Map<String, String> devDependencies) {
        Map<String, Object> scripts = new LinkedHashMap<>();
        scripts.put("dev", "next dev");
        scripts.put("build", "next build");
        scripts.put("start", "next start");
        scripts.put("test", "vitest run");
        scripts.put("db:push", "prisma db push");

        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("name", name);
        pkg.put("version", "0.1.0");
        pkg.put("private", true);
        pkg.put("scripts", scripts);
        pkg.put("dependencies", dependencies);
        pkg.put("devDependencies", devDependencies);
        return json(pkg) + "\n";
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TemplateRenderingException("Failed to serialize generator data", value.getClass().getSimpleName(), e);
        }
    }

    private static Map<String, String> staticFiles() {
        Map<String, String> files = new LinkedHashMap<>();
        for (String path : List.of(
                "tsconfig.json",
                "next.config.js",
                "prisma/migrations/README.md",
                "src/lib/prisma.ts",
                CALCULATIONS_DIR + "runtime.ts",
                CALCULATIONS_DIR + "types.ts",
                "src/app/page.tsx",
                "src/app/globals.css",
                "src/app/api/calculate/route.ts",
                "src/app/api/scenarios/route.ts",
                "src/components/InputForm.tsx",
                "src/components/ResultsDisplay.tsx",
                "src/components/DashboardOverview.tsx")) {
            files.put(path, path);
        }
        files.put(".gitignore", "gitignore");
        return Collections.unmodifiableMap(files);
    }
}
