package com.purchasingpower.calcforge.workflow.pipeline;

import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CompilationPipeline {

    /**
     * All CompilationStep beans, sorted by their @Order.
     */
    private final List<CompilationStep> steps;

    public CompilationContext run(WorkbookStructure workbook) {
        log.info("Starting compilation of workbook: {}", workbook.getFileName());

        CompilationContext context = new CompilationContext(workbook);
        for (CompilationStep step : steps) {
            log.info(">> Executing Step: {}", step.getClass().getSimpleName());
            step.execute(context);
        }

        log.info("Compilation completed for {}", workbook.getFileName());
        return context;
    }
}
