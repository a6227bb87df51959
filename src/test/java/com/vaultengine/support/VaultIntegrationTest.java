package com.vaultengine.support;

import com.vaultengine.fees.FeeConfigRepository;
import com.vaultengine.holdings.AssetHoldingRepository;
import com.vaultengine.holdings.MockAssetCustody;
import com.vaultengine.holdings.ShareHoldingRepository;
import com.vaultengine.journal.RedemptionEventRepository;
import com.vaultengine.ledger.ClaimableRedeemRepository;
import com.vaultengine.ledger.PendingRedeemRepository;
import com.vaultengine.metrics.VaultMetricRepository;
import com.vaultengine.providers.MockPauseGate;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base for flows that must commit or roll back for real.
 *
 * Not transactional: every vault operation opens its own transaction, and a test
 * transaction around it would hide rollbacks. State is wiped before each test instead.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class VaultIntegrationTest {

    @Autowired
    protected PendingRedeemRepository pendingRepository;

    @Autowired
    protected ClaimableRedeemRepository claimableRepository;

    @Autowired
    protected ShareHoldingRepository shareHoldingRepository;

    @Autowired
    protected AssetHoldingRepository assetHoldingRepository;

    @Autowired
    protected FeeConfigRepository feeConfigRepository;

    @Autowired
    protected RedemptionEventRepository eventRepository;

    @Autowired
    protected VaultMetricRepository metricRepository;

    @Autowired
    protected MockAssetCustody custody;

    @Autowired
    protected MockPauseGate pauseGate;

    @Autowired
    protected MutableClock clock;

    @BeforeEach
    void resetVault() {
        pendingRepository.deleteAll();
        claimableRepository.deleteAll();
        shareHoldingRepository.deleteAll();
        assetHoldingRepository.deleteAll();
        feeConfigRepository.deleteAll();
        eventRepository.deleteAll();
        metricRepository.deleteAll();
        pauseGate.unpause();
        clock.set(TestClockConfig.START);
    }
}
