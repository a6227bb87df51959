package com.vaultengine.holdings;

import com.vaultengine.conversion.ConversionEngine;
import com.vaultengine.providers.AssetTransfer;
import com.vaultengine.providers.TotalAssetsSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Total assets as the vault account's custody balances, valued in underlying units.
 *
 * Assets already moved to the claim escrow are excluded: they belong to
 * controllers whose redemptions were fulfilled.
 */
@Component
@Slf4j
public class CustodyTotalAssets implements TotalAssetsSource {

    private final AssetTransfer assetTransfer;
    private final ConversionEngine conversionEngine;
    private final String vaultAccount;
    private final Set<String> assets = new LinkedHashSet<>();

    public CustodyTotalAssets(AssetTransfer assetTransfer,
                              ConversionEngine conversionEngine,
                              @Value("${vault-engine.vault-account:vault}") String vaultAccount,
                              @Value("${vault-engine.supported-assets:}") List<String> supportedAssets) {
        this.assetTransfer = assetTransfer;
        this.conversionEngine = conversionEngine;
        this.vaultAccount = vaultAccount;
        this.assets.add(conversionEngine.getCanonicalAsset());
        supportedAssets.stream()
            .filter(asset -> asset != null && !asset.isBlank())
            .map(String::trim)
            .forEach(this.assets::add);
    }

    @Override
    public BigInteger totalAssets() {
        BigInteger total = BigInteger.ZERO;
        for (String asset : assets) {
            BigInteger balance = assetTransfer.balanceOf(asset, vaultAccount);
            if (balance.signum() > 0) {
                total = total.add(conversionEngine.toUnderlying(asset, balance));
            }
        }
        log.debug("Total assets of {}: {}", vaultAccount, total);
        return total;
    }
}
