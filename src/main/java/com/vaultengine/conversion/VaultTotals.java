package com.vaultengine.conversion;

import com.vaultengine.providers.ShareToken;
import com.vaultengine.providers.TotalAssetsSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads live vault totals into an immutable {@link Totals} snapshot.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultTotals {

    private final TotalAssetsSource totalAssetsSource;
    private final ShareToken shareToken;
    private final ConversionEngine conversionEngine;

    public Totals snapshot() {
        Totals totals = conversionEngine.snapshot(totalAssetsSource.totalAssets(), shareToken.totalSupply());
        log.debug("Totals snapshot: assets={}, supply={}, shareValue={}",
            totals.getTotalAssets(), totals.getTotalSupply(), totals.getShareValue());
        return totals;
    }
}
