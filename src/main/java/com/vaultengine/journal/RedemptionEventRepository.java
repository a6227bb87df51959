package com.vaultengine.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for journal entries.
 */
@Repository
public interface RedemptionEventRepository extends JpaRepository<RedemptionEvent, String> {

    List<RedemptionEvent> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<RedemptionEvent> findByAssetOrderByCreatedAtDesc(String asset);

    List<RedemptionEvent> findByEventType(RedemptionEventType eventType);
}
