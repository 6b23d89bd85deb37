package com.purchasingpower.calcforge.workflow.steps;

import com.purchasingpower.calcforge.model.logic.LogicExtractionResult;
import com.purchasingpower.calcforge.service.logic.LogicExtractor;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationContext;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class LogicExtractionStep implements CompilationStep {

    private final LogicExtractor logicExtractor;

    @Override
    public void execute(CompilationContext context) {
        log.info("Step 3: Extracting business logic");

        LogicExtractionResult logic = logicExtractor.extract(context.requireGraph());
        context.setLogic(logic);

        log.info("✅ {} business rules, {} unsupported features, {} test cases",
                logic.getBusinessRules().size(), logic.getUnsupportedFeatures().size(), logic.getTestSuite().size());
    }
}
