package com.purchasingpower.calcforge.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "calcforge")
public class CalcForgeProperties {

    /**
     * Largest range, in cells, that is expanded into individual addresses.
     * Larger ranges stay a single opaque token everywhere in the compiler.
     */
    @Min(1)
    private int rangeExpansionCap = 1000;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ClassificationProperties classification = new ClassificationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GenerationProperties generation = new GenerationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private CliProperties cli = new CliProperties();
}
