package com.purchasingpower.calcforge.cli;

import com.purchasingpower.calcforge.configuration.CalcForgeProperties;
import com.purchasingpower.calcforge.model.codegen.WorkbookCompilation;
import com.purchasingpower.calcforge.service.compiler.WorkbookCompilerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code --workbook=<export.json> [--output=<dir>]}
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "calcforge.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkbookCompileRunner implements ApplicationRunner {

    static final String WORKBOOK_OPTION = "workbook";
    static final String OUTPUT_OPTION = "output";

    private final WorkbookCompilerService compilerService;
    private final CalcForgeProperties properties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        String workbook = option(args, WORKBOOK_OPTION);
        if (workbook == null) {
            log.info("Usage: --{}=<workbook export (.json/.yaml)> [--{}=<directory, default {}>]",
                    WORKBOOK_OPTION, OUTPUT_OPTION, properties.getCli().getDefaultOutputDir());
            return;
        }
        String output = option(args, OUTPUT_OPTION);
        Path outputDir = Path.of(output != null ? output : properties.getCli().getDefaultOutputDir());

        WorkbookCompilation compilation = compilerService.compile(Path.of(workbook));
        int files = compilerService.writeProject(compilation.getProject(), outputDir);

        log.info("Compiled {} into {} ({} files, {} calculations, {} unsupported features)",
                compilation.getWorkbookName(), outputDir, files,
                compilation.getLogic().getBusinessRules().size(),
                compilation.getLogic().getUnsupportedFeatures().size());
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
