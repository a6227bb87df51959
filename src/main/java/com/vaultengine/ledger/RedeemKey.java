package com.vaultengine.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite (account, asset) key of redemption records.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RedeemKey implements Serializable {

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "asset", nullable = false)
    private String asset;
}
