package com.vaultengine.metrics;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for share-price history.
 */
@Repository
public interface VaultMetricRepository extends JpaRepository<VaultMetric, Long> {

    List<VaultMetric> findByCapturedAtGreaterThanEqualOrderByCapturedAtAsc(Instant since);
}
