package com.vaultengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;

/**
 * Repository for pending redemption records.
 */
@Repository
public interface PendingRedeemRepository extends JpaRepository<PendingRedeem, RedeemKey> {

    @Query("select sum(p.shares) from PendingRedeem p")
    BigInteger sumShares();
}
