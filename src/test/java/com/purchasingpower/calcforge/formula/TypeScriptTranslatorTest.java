package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.formula.ast.ErrorNode;
import com.purchasingpower.calcforge.formula.ast.FunctionNode;
import com.purchasingpower.calcforge.formula.ast.RangeNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TypeScript Translator Tests")
class TypeScriptTranslatorTest {

    private static final ReferenceResolutionContext SHEET = ReferenceResolutionContext.forSheet("S");

    private FormulaParser parser;
    private TypeScriptTranslator translator;

    @BeforeEach
    void setUp() {
        RangeExpander expander = new RangeExpander(4);
        parser = new FormulaParser(new FormulaTokenizer(), expander);
        translator = new TypeScriptTranslator(expander);
    }

    private TranslationResult translate(String formula) {
        return translator.translate(parser.parseExpression(formula, SHEET));
    }

    // ======================================================================
    // SUPPORTED FORMULAS
    // ======================================================================

    @Test
    @DisplayName("Should coerce arithmetic operands through the runtime")
    void testArithmetic_ShouldUseNumericCoercion() {
        TranslationResult result = translate("=A1+B1");

        assertTrue(result.isClean());
        assertEquals("(rt.num(ref(\"S!A1\")) + rt.num(ref(\"S!B1\")))", result.getExpression());
    }

    @Test
    @DisplayName("Should route division through the zero-safe helper")
    void testDivision_ShouldUseDivideHelper() {
        assertEquals("rt.divide(ref(\"S!A1\"), ref(\"S!B1\"))", translate("=A1/B1").getExpression());
    }

    @Test
    @DisplayName("Should translate IF into a lazy conditional expression")
    void testIf_ShouldBecomeTernary() {
        assertEquals("(rt.truthy((rt.compare(ref(\"S!A1\"), 0) > 0)) ? 1 : 2)",
                translate("=IF(A1>0,1,2)").getExpression());
    }

    @Test
    @DisplayName("Should wrap IFERROR arguments in thunks")
    void testIfError_ShouldDeferBothBranches() {
        assertEquals("rt.ifError(() => rt.divide(ref(\"S!A1\"), ref(\"S!B1\")), () => 0)",
                translate("=IFERROR(A1/B1,0)").getExpression());
    }

    @Test
    @DisplayName("Should expand small ranges into nested arrays")
    void testRange_ShouldExpandWithinCap() {
        assertEquals("rt.sum([[ref(\"S!A1\")], [ref(\"S!A2\")]])", translate("=SUM(A1:A2)").getExpression());
    }

    @Test
    @DisplayName("Should escape quotes inside string literals")
    void testStringLiteral_ShouldBeEscaped() {
        assertEquals("(rt.text(\"a\\\"b\") + rt.text(ref(\"S!A1\")))", translate("=\"a\"\"b\"&A1").getExpression());
    }

    // ======================================================================
    // PARTIAL AND UNSUPPORTED FORMULAS
    // ======================================================================

    @Test
    @DisplayName("Should stub ranges above the expansion cap and record the problem")
    void testOpaqueRange_ShouldEmitUnsupportedRange() {
        TranslationResult result = translate("=SUM(A1:A10)");

        assertTrue(result.isSupported());
        assertFalse(result.isClean());
        assertEquals("rt.sum(rt.unsupportedRange(\"S!A1:A10\"))", result.getExpression());
        assertEquals(List.of("Range S!A1:A10 exceeds the 4-cell expansion limit"), result.getProblems());
    }

    @Test
    @DisplayName("Should stub ranges without a sheet")
    void testSheetlessRange_ShouldEmitUnsupportedRange() {
        TranslationResult result = translator.translate(new FunctionNode("SUM", List.of(new RangeNode("A1:A2"))));

        assertTrue(result.isSupported());
        assertEquals(List.of("Range A1:A2 has no resolvable sheet"), result.getProblems());
    }

    @Test
    @DisplayName("Should refuse functions that build references at runtime")
    void testDynamicReference_ShouldBeUnsupported() {
        TranslationResult result = translate("=INDIRECT(\"B\"&A1)");

        assertFalse(result.isSupported());
        assertNull(result.getExpression());
        assertEquals(List.of("INDIRECT builds references at runtime"), result.getProblems());
    }

    @Test
    @DisplayName("Should refuse unknown functions")
    void testUnknownFunction_ShouldBeUnsupported() {
        assertEquals(List.of("Unsupported function: NPV"), translate("=NPV(0.1,A1:A2)").getProblems());
    }

    @Test
    @DisplayName("Should refuse malformed formulas")
    void testErrorNode_ShouldBeUnsupported() {
        TranslationResult result = translator.translate(new ErrorNode("missing operand"));

        assertFalse(result.isSupported());
        assertEquals(List.of("Malformed formula: missing operand"), result.getProblems());
    }
}
