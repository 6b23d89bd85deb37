package com.purchasingpower.calcforge.model.codegen;

import com.purchasingpower.calcforge.model.logic.TestCase;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source tree of the generated application: relative path to UTF-8 text.
 */
@Value
@Builder
public class GeneratedProject {

    String projectName;

    /**
     * Sorted by path.
     */
    @Builder.Default
    Map<String, String> files = Map.of();

    @Builder.Default
    Map<String, String> dependencies = Map.of();

    @Builder.Default
    Map<String, String> devDependencies = Map.of();

    /**
     * Contents of {@code prisma/schema.prisma}.
     */
    String relationalSchema;

    @Builder.Default
    List<TestCase> testSuite = List.of();

    @Builder.Default
    List<FieldDefinition> inputFields = List.of();

    @Builder.Default
    List<FieldDefinition> outputFields = List.of();

    public Optional<String> file(String path) {
        return Optional.ofNullable(files.get(path));
    }
}
