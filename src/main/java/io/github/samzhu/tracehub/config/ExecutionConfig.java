package io.github.samzhu.tracehub.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.tracehub.execution.OperationalPathClassifier;

/**
 * 執行追蹤元件配置
 *
 * @see ExecutionProperties
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public OperationalPathClassifier operationalPathClassifier(ExecutionProperties properties) {
        if (!properties.additionalOperationalPaths().isEmpty()) {
            log.info("Additional operational paths: {}", properties.additionalOperationalPaths());
        }
        return new OperationalPathClassifier(properties.additionalOperationalPaths());
    }
}
