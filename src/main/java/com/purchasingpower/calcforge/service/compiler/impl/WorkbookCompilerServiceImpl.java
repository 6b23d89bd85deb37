package com.purchasingpower.calcforge.service.compiler.impl;

import com.purchasingpower.calcforge.model.codegen.GeneratedProject;
import com.purchasingpower.calcforge.model.codegen.WorkbookCompilation;
import com.purchasingpower.calcforge.model.workbook.WorkbookStructure;
import com.purchasingpower.calcforge.service.compiler.WorkbookCompilerService;
import com.purchasingpower.calcforge.service.reader.WorkbookReader;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationContext;
import com.purchasingpower.calcforge.workflow.pipeline.CompilationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkbookCompilerServiceImpl implements WorkbookCompilerService {

    private final WorkbookReader workbookReader;
    private final CompilationPipeline pipeline;

    @Override
    public WorkbookCompilation compile(Path workbookPath) {
        return compile(workbookReader.read(workbookPath));
    }

    @Override
    public WorkbookCompilation compile(WorkbookStructure workbook) {
        CompilationContext context = pipeline.run(workbook);
        return WorkbookCompilation.builder()
                .workbookName(context.getWorkbookName())
                .classification(context.requireClassification())
                .graph(context.requireGraph())
                .logic(context.requireLogic())
                .project(context.requireProject())
                .build();
    }

    @Override
    public int writeProject(GeneratedProject project, Path outputDir) throws IOException {
        Path root = outputDir.toAbsolutePath().normalize();
        log.info("Writing generated project to {}", root);

        int written = 0;
        for (Map.Entry<String, String> file : project.getFiles().entrySet()) {
            Path target = root.resolve(file.getKey()).normalize();
            if (!target.startsWith(root)) {
                throw new IOException("Generated path escapes output directory: " + file.getKey());
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            log.debug("Wrote {}", file.getKey());
            written++;
        }

        log.info("✅ Wrote {} files", written);
        return written;
    }
}
