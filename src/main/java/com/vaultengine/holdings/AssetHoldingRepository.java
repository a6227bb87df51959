package com.vaultengine.holdings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for asset balances.
 */
@Repository
public interface AssetHoldingRepository extends JpaRepository<AssetHolding, HoldingKey> {
}
