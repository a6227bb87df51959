package com.vaultengine.holdings;

import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Share balance of one holder.
 */
@Entity
@Table(name = "share_holdings")
@Data
@NoArgsConstructor
public class ShareHolding {

    @Id
    private String holder;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger balance;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public ShareHolding(String holder) {
        this.holder = holder;
        this.balance = BigInteger.ZERO;
        this.updatedAt = Instant.now();
    }

    public void credit(BigInteger amount) {
        this.balance = UintMath.checkedAdd(balance, amount, UintMath.MAX_UINT256, VaultErrorCode.ARITHMETIC_OVERFLOW);
        this.updatedAt = Instant.now();
    }

    public void debit(BigInteger amount) {
        this.balance = UintMath.checkedSub(balance, amount, VaultErrorCode.INSUFFICIENT_BALANCE);
        this.updatedAt = Instant.now();
    }
}
