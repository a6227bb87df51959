package com.vaultengine.api.controller;

import com.vaultengine.api.dto.DepositRequest;
import com.vaultengine.redemption.RedemptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;

/**
 * REST API for synchronous deposits.
 */
@RestController
@RequestMapping("/api/v1/deposits")
@RequiredArgsConstructor
@Tag(name = "Deposits", description = "Deposit assets for shares")
public class DepositController {

    private final RedemptionService redemptionService;

    @PostMapping("/{asset}")
    @Operation(summary = "Deposit assets and mint shares to a receiver")
    public ResponseEntity<Map<String, BigInteger>> deposit(
            @PathVariable String asset,
            @RequestHeader(RedemptionController.CALLER_HEADER) String caller,
            @Valid @RequestBody DepositRequest request) {
        BigInteger shares = redemptionService.deposit(asset, request.getAssets(), request.getReceiver(), caller);
        return ResponseEntity.ok(Map.of("shares", shares));
    }

    @GetMapping("/{asset}/preview")
    @Operation(summary = "Shares a deposit would mint at current totals")
    public ResponseEntity<Map<String, BigInteger>> previewDeposit(
            @PathVariable String asset,
            @RequestParam BigInteger assets) {
        return ResponseEntity.ok(Map.of("shares", redemptionService.previewDeposit(asset, assets)));
    }
}
