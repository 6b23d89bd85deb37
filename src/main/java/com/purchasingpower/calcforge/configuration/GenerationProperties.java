package com.purchasingpower.calcforge.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class GenerationProperties {

    @NotBlank
    private String projectName = "excel-app";

    private Map<String, String> dependencies = new LinkedHashMap<>(Map.of(
            "next", "14.2.3",
            "react", "18.3.1",
            "react-dom", "18.3.1",
            "@prisma/client", "5.14.0",
            "zod", "3.23.8"));

    private Map<String, String> devDependencies = new LinkedHashMap<>(Map.of(
            "typescript", "5.4.5",
            "prisma", "5.14.0",
            "vitest", "1.6.0",
            "@types/node", "20.12.12",
            "@types/react", "18.3.2"));
}
