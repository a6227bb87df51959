package com.vaultengine.metrics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class VaultMetricsSchedulerTest {

    @Mock
    private VaultMetricsService metricsService;

    @InjectMocks
    private VaultMetricsScheduler scheduler;

    @Test
    void testCaptureTakesSnapshot() {
        scheduler.capture();

        verify(metricsService).captureSnapshot();
    }
}
