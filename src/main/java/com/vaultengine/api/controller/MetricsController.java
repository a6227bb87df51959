package com.vaultengine.api.controller;

import com.vaultengine.metrics.PerformanceSummary;
import com.vaultengine.metrics.VaultMetric;
import com.vaultengine.metrics.VaultMetricsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * REST API for share-price history.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
@Tag(name = "Metrics", description = "Share price and TVL history")
public class MetricsController {

    private final VaultMetricsService metricsService;

    @PostMapping("/snapshots")
    @Operation(summary = "Capture a share-price snapshot now")
    public ResponseEntity<VaultMetric> captureSnapshot() {
        return ResponseEntity.ok(metricsService.captureSnapshot());
    }

    @GetMapping("/snapshots")
    @Operation(summary = "Snapshots of the trailing window")
    public ResponseEntity<List<VaultMetric>> history(@RequestParam(defaultValue = "90") int days) {
        return ResponseEntity.ok(metricsService.history(Duration.ofDays(days)));
    }

    @GetMapping("/performance")
    @Operation(summary = "Return, TVL change and APR over the trailing window")
    public ResponseEntity<PerformanceSummary> performance(@RequestParam(defaultValue = "90") int days) {
        return metricsService.performance(Duration.ofDays(days))
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
