package com.purchasingpower.calcforge.service.codegen;

import com.purchasingpower.calcforge.model.codegen.GeneratedProject;

/**
 * Last compiler stage: emits the source tree of a small web application that
 * reproduces the workbook's calculations.
 *
 * <p>Generation never fails because a formula is unsupported; that calculation becomes
 * a function throwing at runtime and its rule constraints explain why.
 */
public interface CodeGenerator {

    GeneratedProject generate(CodeGenerationRequest request);
}
