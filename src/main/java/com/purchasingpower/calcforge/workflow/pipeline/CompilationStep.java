package com.purchasingpower.calcforge.workflow.pipeline;

/**
 * One stage of the workbook compilation.
 * Implementations are detected by Spring and sorted by @Order.
 */
public interface CompilationStep {

    /**
     * Runs this stage against the shared context.
     *
     * @param context state gathered by the previous steps
     * @throws IllegalStateException if a predecessor's result is missing
     */
    void execute(CompilationContext context);
}
