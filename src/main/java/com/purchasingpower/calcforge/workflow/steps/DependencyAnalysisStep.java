package com.purchasingpower.calcforge.workflow.steps;

import com.purchasingpower.calcforge.model.graph.DependencyGraph;
import com.purchasingpower.calcforge.service.graph.DependencyGraphBuilder;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationContext;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class DependencyAnalysisStep implements CompilationStep {

    private final DependencyGraphBuilder graphBuilder;

    @Override
    public void execute(CompilationContext context) {
        log.info("Step 2: Building dependency graph");

        DependencyGraph graph = graphBuilder.build(context.requireClassification());
        context.setGraph(graph);

        if (!graph.getCircularRefs().isEmpty()) {
            log.warn("{} circular reference group(s) left out of the execution order",
                    graph.getCircularRefs().size());
        }
        log.info("✅ Graph: {} nodes, {} edges, {} clusters",
                graph.getNodes().size(), graph.getEdges().size(), graph.getClusters().size());
    }
}
