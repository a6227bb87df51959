package com.vaultengine.api.dto;

import com.vaultengine.ledger.ClaimableRedeem;
import com.vaultengine.ledger.PendingRedeem;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Pending and claimable redemption state of one (account, asset).
 */
@Value
@Builder
public class RedemptionStateResponse {

    String account;
    String asset;
    BigInteger pendingShares;
    long requestTime;
    BigInteger claimableAssets;
    BigInteger claimableShares;

    public static RedemptionStateResponse of(PendingRedeem pending, ClaimableRedeem claimable) {
        return RedemptionStateResponse.builder()
            .account(pending.getId().getAccountId())
            .asset(pending.getId().getAsset())
            .pendingShares(pending.getShares())
            .requestTime(pending.getRequestTime())
            .claimableAssets(claimable.getAssets())
            .claimableShares(claimable.getShares())
            .build();
    }
}
