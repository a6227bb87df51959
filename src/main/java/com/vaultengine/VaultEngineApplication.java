package com.vaultengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Vault Engine.
 *
 * Vault Engine runs the asynchronous redemption ledger of a multi-asset tokenized vault:
 * redemption requests, operator fulfillment at a single price snapshot, claims, and
 * management, performance and withdrawal fee accrual.
 */
@SpringBootApplication
public class VaultEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultEngineApplication.class, args);
    }
}
