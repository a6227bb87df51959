package com.vaultengine.api.controller;

import com.vaultengine.api.dto.CancelRedeemRequest;
import com.vaultengine.api.dto.ClaimRedeemRequest;
import com.vaultengine.api.dto.FulfillBatchEntry;
import com.vaultengine.api.dto.FulfillBatchRequest;
import com.vaultengine.api.dto.FulfillRedeemRequest;
import com.vaultengine.api.dto.RedeemRequest;
import com.vaultengine.api.dto.RedemptionStateResponse;
import com.vaultengine.api.dto.WithdrawRequest;
import com.vaultengine.journal.RedemptionEvent;
import com.vaultengine.journal.RedemptionJournal;
import com.vaultengine.redemption.RedemptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for the asynchronous redemption lifecycle.
 */
@RestController
@RequestMapping("/api/v1/redemptions")
@RequiredArgsConstructor
@Tag(name = "Redemptions", description = "Request, fulfill and claim redemptions")
public class RedemptionController {

    static final String CALLER_HEADER = "X-Vault-Caller";

    private final RedemptionService redemptionService;
    private final RedemptionJournal journal;

    @PostMapping("/{asset}/requests")
    @Operation(summary = "Escrow shares for redemption into an asset")
    public ResponseEntity<Map<String, BigInteger>> requestRedeem(
            @PathVariable String asset,
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody RedeemRequest request) {
        BigInteger requestId = redemptionService.requestRedeem(
            asset, request.getShares(), request.getController(), request.getOwner(), caller);
        return ResponseEntity.ok(Map.of("requestId", requestId));
    }

    @PostMapping("/{asset}/cancel")
    @Operation(summary = "Cancel a pending redemption, fully or partially")
    public ResponseEntity<Map<String, BigInteger>> cancelRedeem(
            @PathVariable String asset,
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CancelRedeemRequest request) {
        BigInteger canceled = request.getShares() == null
            ? redemptionService.cancelRedeem(asset, request.getController(), request.getReceiver(), caller)
            : redemptionService.cancelRedeemPartial(
                asset, request.getShares(), request.getController(), request.getReceiver(), caller);
        return ResponseEntity.ok(Map.of("sharesCanceled", canceled));
    }

    @PostMapping("/{asset}/fulfill")
    @Operation(summary = "Fulfill pending shares of one controller (operator only)")
    public ResponseEntity<Map<String, BigInteger>> fulfillRedeem(
            @PathVariable String asset,
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody FulfillRedeemRequest request) {
        BigInteger assets = redemptionService.fulfillRedeem(
            asset, request.getShares(), request.getController(), caller);
        return ResponseEntity.ok(Map.of("assetsFulfilled", assets));
    }

    @PostMapping("/fulfill-batch")
    @Operation(summary = "Fulfill several redemptions from one price snapshot (operator only)")
    public ResponseEntity<List<BigInteger>> fulfillBatch(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody FulfillBatchRequest request) {
        List<FulfillBatchEntry> entries = request.getEntries();
        List<BigInteger> fulfilled = redemptionService.fulfillBatch(
            entries.stream().map(FulfillBatchEntry::getAsset).collect(Collectors.toList()),
            entries.stream().map(FulfillBatchEntry::getShares).collect(Collectors.toList()),
            entries.stream().map(FulfillBatchEntry::getController).collect(Collectors.toList()),
            caller);
        return ResponseEntity.ok(fulfilled);
    }

    @PostMapping("/{asset}/withdraw")
    @Operation(summary = "Withdraw claimable assets by asset amount")
    public ResponseEntity<Map<String, BigInteger>> withdraw(
            @PathVariable String asset,
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody WithdrawRequest request) {
        BigInteger shares = redemptionService.withdraw(
            asset, request.getAssets(), request.getReceiver(), request.getController(), caller);
        return ResponseEntity.ok(Map.of("sharesBurned", shares));
    }

    @PostMapping("/{asset}/redeem")
    @Operation(summary = "Withdraw claimable assets by share amount")
    public ResponseEntity<Map<String, BigInteger>> redeem(
            @PathVariable String asset,
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody ClaimRedeemRequest request) {
        BigInteger assets = redemptionService.redeem(
            asset, request.getShares(), request.getReceiver(), request.getController(), caller);
        return ResponseEntity.ok(Map.of("assetsReceived", assets));
    }

    @GetMapping("/{asset}/preview")
    @Operation(summary = "Gross assets a fulfillment of the given shares would price at current totals")
    public ResponseEntity<Map<String, BigInteger>> previewRedeem(
            @PathVariable String asset,
            @RequestParam BigInteger shares) {
        return ResponseEntity.ok(Map.of("assets", redemptionService.previewRedeem(asset, shares)));
    }

    @GetMapping("/{asset}/{account}")
    @Operation(summary = "Pending and claimable state of an account")
    public ResponseEntity<RedemptionStateResponse> getState(
            @PathVariable String asset,
            @PathVariable String account) {
        return ResponseEntity.ok(RedemptionStateResponse.of(
            redemptionService.getPending(asset, account),
            redemptionService.getClaimable(asset, account)));
    }

    @GetMapping("/{asset}/{account}/limits")
    @Operation(summary = "Maximum withdrawable assets and redeemable shares")
    public ResponseEntity<Map<String, BigInteger>> getLimits(
            @PathVariable String asset,
            @PathVariable String account) {
        return ResponseEntity.ok(Map.of(
            "maxWithdraw", redemptionService.maxWithdraw(asset, account),
            "maxRedeem", redemptionService.maxRedeem(asset, account)));
    }

    @GetMapping("/journal/assets/{asset}")
    @Operation(summary = "Journal of redemption events in an asset")
    public ResponseEntity<List<RedemptionEvent>> getAssetJournal(@PathVariable String asset) {
        return ResponseEntity.ok(journal.getAssetJournal(asset));
    }

    @GetMapping("/journal/{account}")
    @Operation(summary = "Journal of an account's redemption events")
    public ResponseEntity<List<RedemptionEvent>> getJournal(@PathVariable String account) {
        return ResponseEntity.ok(journal.getAccountJournal(account));
    }
}
