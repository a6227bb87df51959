package com.vaultengine.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on scheduling only when periodic metric capture is enabled.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "vault-engine.metrics.capture-enabled", havingValue = "true")
public class SchedulingConfig {
}
