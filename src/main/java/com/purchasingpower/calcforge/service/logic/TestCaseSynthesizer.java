package com.purchasingpower.calcforge.service.logic;

import com.purchasingpower.calcforge.formula.ClusterEvaluationResult;
import com.purchasingpower.calcforge.formula.FormulaEvaluator;
import com.purchasingpower.calcforge.formula.ValueCoercion;
import com.purchasingpower.calcforge.model.logic.ParsedFormula;
import com.purchasingpower.calcforge.model.logic.TestCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds regression test cases for a calculation by seeding every input with the same
 * value and recording what the evaluator computes.
 *
 * <p>Seeds are 0, 1 and the first non-zero number literal of the formulas (skipped
 * when it is 1).
 */
@Slf4j
@RequiredArgsConstructor
public class TestCaseSynthesizer {

    private final FormulaEvaluator evaluator;

    public List<TestCase> synthesize(String calculationId, List<String> inputs, List<ParsedFormula> formulas) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        List<TestCase> cases = new ArrayList<>();
        seeded(calculationId + "_default", calculationId, inputs, formulas, 0.0).ifPresent(cases::add);
        seeded(calculationId + "_seed_1", calculationId, inputs, formulas, 1.0).ifPresent(cases::add);
        literalSeed(formulas)
                .filter(seed -> seed != 1.0)
                .flatMap(seed -> seeded(calculationId + "_seed_" + ValueCoercion.formatNumber(seed),
                        calculationId, inputs, formulas, seed))
                .ifPresent(cases::add);
        return List.copyOf(cases);
    }

    private Optional<TestCase> seeded(String name, String calculationId, List<String> inputs,
                                      List<ParsedFormula> formulas, double seed) {
        Map<String, Object> payload = new LinkedHashMap<>();
        inputs.forEach(address -> payload.put(address, seed));
        ClusterEvaluationResult result = evaluator.evaluateInOrder(formulas, payload);
        if (!result.isSuccess()) {
            log.warn("No test case {} for {}: {}", name, calculationId, result.getError());
            return Optional.empty();
        }
        return Optional.of(TestCase.builder()
                .name(name)
                .calculationId(calculationId)
                .inputs(payload)
                .expected(result.getValues())
                .build());
    }

    static Optional<Double> literalSeed(List<ParsedFormula> formulas) {
        for (ParsedFormula formula : formulas) {
            for (Object constant : formula.getConstants()) {
                if (constant instanceof Double number && number != 0 && !number.isNaN() && !number.isInfinite()) {
                    return Optional.of(number);
                }
            }
        }
        return Optional.empty();
    }
}
