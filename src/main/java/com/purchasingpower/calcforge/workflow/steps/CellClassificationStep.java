package com.purchasingpower.calcforge.workflow.steps;

import com.purchasingpower.calcforge.model.classification.CellClassificationResult;
import com.purchasingpower.calcforge.service.classification.CellClassifier;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationContext;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class CellClassificationStep implements CompilationStep {

    private final CellClassifier cellClassifier;

    @Override
    public void execute(CompilationContext context) {
        log.info("Step 1: Classifying cells of {}", context.getWorkbookName());

        CellClassificationResult classification = cellClassifier.classify(context.requireWorkbook());
        context.setClassification(classification);

        log.info("✅ Classified {} cells on {} sheets",
                classification.allCells().size(), classification.getSheets().size());
    }
}
