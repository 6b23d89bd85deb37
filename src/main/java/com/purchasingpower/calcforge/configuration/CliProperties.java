package com.purchasingpower.calcforge.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CliProperties {

    private boolean enabled = true;

    /**
     * Directory the generated project is written to when --output is not given.
     */
    @NotBlank
    private String defaultOutputDir = "generated-app";
}
