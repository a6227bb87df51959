package com.vaultengine.journal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * Append-only journal of redemption, deposit and fee events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedemptionJournal {

    private final RedemptionEventRepository eventRepository;

    @Transactional
    public void recordRequest(String controller, String owner, String asset, BigInteger shares, String caller) {
        append(new RedemptionEvent(RedemptionEventType.REDEEM_REQUEST, controller, owner, asset,
            shares, null, null, caller));
    }

    @Transactional
    public void recordCancel(String controller, String receiver, String asset, BigInteger shares, String caller) {
        append(new RedemptionEvent(RedemptionEventType.REDEEM_CANCEL, controller, receiver, asset,
            shares, null, null, caller));
    }

    @Transactional
    public void recordFulfill(String controller, String asset, BigInteger shares, BigInteger assets,
                              BigInteger withdrawalFee, String caller) {
        append(new RedemptionEvent(RedemptionEventType.REDEEM_FULFILL, controller, null, asset,
            shares, assets, withdrawalFee, caller));
    }

    @Transactional
    public void recordWithdraw(String controller, String receiver, String asset, BigInteger shares,
                               BigInteger assets, String caller) {
        append(new RedemptionEvent(RedemptionEventType.WITHDRAW, controller, receiver, asset,
            shares, assets, null, caller));
    }

    @Transactional
    public void recordRedeem(String controller, String receiver, String asset, BigInteger shares,
                             BigInteger assets, String caller) {
        append(new RedemptionEvent(RedemptionEventType.REDEEM, controller, receiver, asset,
            shares, assets, null, caller));
    }

    @Transactional
    public void recordDeposit(String receiver, String asset, BigInteger shares, BigInteger assets, String caller) {
        append(new RedemptionEvent(RedemptionEventType.DEPOSIT, receiver, caller, asset,
            shares, assets, null, caller));
    }

    @Transactional
    public void recordFeeSettlement(String feeRecipient, BigInteger feeShares, BigInteger totalFee) {
        append(new RedemptionEvent(RedemptionEventType.FEE_SETTLEMENT, feeRecipient, null, null,
            feeShares, null, totalFee, null));
    }

    @Transactional
    public void recordFeeUpdate(String caller) {
        append(new RedemptionEvent(RedemptionEventType.FEE_UPDATE, caller, null, null,
            null, null, null, caller));
    }

    @Transactional(readOnly = true)
    public List<RedemptionEvent> getAccountJournal(String accountId) {
        return eventRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<RedemptionEvent> getAssetJournal(String asset) {
        return eventRepository.findByAssetOrderByCreatedAtDesc(asset);
    }

    private void append(RedemptionEvent event) {
        eventRepository.save(event);
        log.debug("Journaled {}: account={}, asset={}, shares={}, assets={}",
            event.getEventType(), event.getAccountId(), event.getAsset(), event.getShares(), event.getAssets());
    }
}
