package com.architecture.memory.workflowscan.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of the service.
 */
@Configuration
@EnableConfigurationProperties({
        ScannerProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
