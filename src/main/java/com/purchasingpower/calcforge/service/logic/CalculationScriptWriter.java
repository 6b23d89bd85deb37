package com.purchasingpower.calcforge.service.logic;

import com.purchasingpower.calcforge.util.CellAddresses;
import com.purchasingpower.calcforge.util.TypeScriptLiterals;

import java.util.List;

/**
 * Writes the TypeScript function of one calculation. The function records every
 * computed cell in {@code computed}, reading earlier results before the inputs.
 */
public final class CalculationScriptWriter {

    private CalculationScriptWriter() {
    }

    public record Assignment(String target, String formula, String expression) {
    }

    public static String functionName(String calculationId) {
        return "calculate_" + CellAddresses.toIdentifier(calculationId);
    }

    public static String function(String calculationId, List<Assignment> assignments) {
        StringBuilder ts = new StringBuilder();
        ts.append("export const ").append(functionName(calculationId)).append(": CalculationFn = (inputs) => {\n");
        ts.append("  const computed: CalculationResult = {};\n");
        ts.append("  const ref = (address: string): CellValue => rt.getValue(address, inputs, computed);\n");
        for (Assignment assignment : assignments) {
            ts.append("  // ").append(TypeScriptLiterals.lineComment(assignment.target() + " " + assignment.formula())).append('\n');
            ts.append("  computed[").append(TypeScriptLiterals.string(assignment.target())).append("] = rt.result(")
                    .append(assignment.expression()).append(");\n");
        }
        ts.append("  return computed;\n");
        ts.append("};\n");
        return ts.toString();
    }

    /**
     * Function that throws when called, for calculations that cannot be compiled.
     */
    public static String stub(String calculationId, List<String> reasons) {
        String message = calculationId + " cannot be computed: " + String.join("; ", reasons);
        StringBuilder ts = new StringBuilder();
        for (String reason : reasons) {
            ts.append("// ").append(TypeScriptLiterals.lineComment(reason)).append('\n');
        }
        ts.append("export const ").append(functionName(calculationId)).append(": CalculationFn = () => {\n");
        ts.append("  throw new Error(").append(TypeScriptLiterals.string(message)).append(");\n");
        ts.append("};\n");
        return ts.toString();
    }
}
