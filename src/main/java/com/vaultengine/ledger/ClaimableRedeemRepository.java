package com.vaultengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;

/**
 * Repository for claimable redemption records.
 */
@Repository
public interface ClaimableRedeemRepository extends JpaRepository<ClaimableRedeem, RedeemKey> {

    @Query("select sum(c.shares) from ClaimableRedeem c")
    BigInteger sumShares();

    @Query("select sum(c.assets) from ClaimableRedeem c where c.id.asset = :asset")
    BigInteger sumAssetsByAsset(@Param("asset") String asset);
}
