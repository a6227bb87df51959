package com.vaultengine.metrics;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic share-price capture. Enabled with {@code vault-engine.metrics.capture-enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "vault-engine.metrics.capture-enabled", havingValue = "true")
@RequiredArgsConstructor
public class VaultMetricsScheduler {

    private final VaultMetricsService metricsService;

    @Scheduled(fixedDelayString = "${vault-engine.metrics.capture-interval-ms:300000}")
    public void capture() {
        metricsService.captureSnapshot();
    }
}
