package com.vaultengine.holdings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;

/**
 * Repository for share balances.
 */
@Repository
public interface ShareHoldingRepository extends JpaRepository<ShareHolding, String> {

    /**
     * Sum of all balances, or {@code null} when there are no holders.
     */
    @Query("select sum(h.balance) from ShareHolding h")
    BigInteger sumBalances();
}
