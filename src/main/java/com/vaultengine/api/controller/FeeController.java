package com.vaultengine.api.controller;

import com.vaultengine.api.dto.FeeRatesRequest;
import com.vaultengine.fees.FeeRates;
import com.vaultengine.fees.FeeService;
import com.vaultengine.fees.FeeSettlement;
import com.vaultengine.fees.Fees;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for fee configuration and settlement.
 */
@RestController
@RequestMapping("/api/v1/fees")
@RequiredArgsConstructor
@Tag(name = "Fees", description = "Fee configuration API")
public class FeeController {

    private final FeeService feeService;

    @GetMapping
    @Operation(summary = "Current fee configuration")
    public ResponseEntity<Fees> getFees() {
        return ResponseEntity.ok(feeService.getFees());
    }

    @PutMapping
    @Operation(summary = "Replace fee rates (fee manager only)")
    public ResponseEntity<Fees> updateFees(
            @RequestHeader(RedemptionController.CALLER_HEADER) String caller,
            @Valid @RequestBody FeeRatesRequest request) {
        FeeRates rates = FeeRates.builder()
            .performanceFeeRate(request.getPerformanceFeeRate())
            .managementFeeRate(request.getManagementFeeRate())
            .withdrawalFeeRate(request.getWithdrawalFeeRate())
            .build();
        return ResponseEntity.ok(feeService.updateFees(rates, caller));
    }

    @PostMapping("/settle")
    @Operation(summary = "Settle accrued management and performance fees")
    public ResponseEntity<FeeSettlement> settleFees() {
        return ResponseEntity.ok(feeService.settleFees());
    }
}
