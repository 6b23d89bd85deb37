package com.purchasingpower.calcforge.workflow.steps;

import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.service.codegen.CodeGenerationRequest;
import com.purchasingpower.calcforge.service.codegen.CodeGenerator;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationContext;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(4)
@RequiredArgsConstructor
public class CodeGenerationStep implements CompilationStep {

    private final CodeGenerator codeGenerator;

    @Override
    public void execute(CompilationContext context) {
        log.info("Step 4: Generating application sources");

        GeneratedProject project = codeGenerator.generate(CodeGenerationRequest.builder()
                .classification(context.requireClassification())
                .graph(context.requireGraph())
                .logic(context.requireLogic())
                .build());
        context.setProject(project);

        log.info("✅ Generated {} files", project.getFiles().size());
    }
}
