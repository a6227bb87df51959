package com.vaultengine.fees;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for the fee configuration row.
 */
@Repository
public interface FeeConfigRepository extends JpaRepository<FeeConfig, String> {
}
