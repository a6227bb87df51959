package com.vaultengine.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory pause flag.
 *
 * In production, pausing is owned by the host's administration layer.
 */
@Component
@Slf4j
public class MockPauseGate implements PauseGate {

    private final AtomicBoolean paused = new AtomicBoolean(false);

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    public void pause() {
        paused.set(true);
        log.info("Vault paused");
    }

    public void unpause() {
        paused.set(false);
        log.info("Vault unpaused");
    }
}
