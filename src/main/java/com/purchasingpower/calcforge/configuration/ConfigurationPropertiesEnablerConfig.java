package com.purchasingpower.calcforge.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the compiler's {@code @ConfigurationProperties} classes, bound from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
        CalcForgeProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
