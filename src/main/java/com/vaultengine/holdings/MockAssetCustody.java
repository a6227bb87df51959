package com.vaultengine.holdings;

import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.providers.AssetTransfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Asset custody backed by the local database.
 *
 * Simulates token contracts for every asset the vault handles. Balances are
 * transactional, so they roll back together with the operation that moved them.
 *
 * NOT FOR PRODUCTION: real deployments move assets through the host's token contracts.
 */
@Component
@Slf4j
public class MockAssetCustody implements AssetTransfer {

    private final AssetHoldingRepository holdingRepository;
    private final String vaultAccount;

    public MockAssetCustody(AssetHoldingRepository holdingRepository,
                            @Value("${vault-engine.vault-account:vault}") String vaultAccount) {
        this.holdingRepository = holdingRepository;
        this.vaultAccount = vaultAccount;
    }

    @Override
    @Transactional
    public void transfer(String asset, String to, BigInteger amount) {
        transferFrom(asset, vaultAccount, to, amount);
    }

    @Override
    @Transactional
    public void transferFrom(String asset, String from, String to, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        AssetHolding source = holdingRepository.findById(new HoldingKey(from, asset))
            .orElseThrow(() -> new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE,
                from + " holds no " + asset));
        source.debit(amount);
        holdingRepository.save(source);

        AssetHolding target = findOrCreate(to, asset);
        target.credit(amount);
        holdingRepository.save(target);

        log.info("Transferred {} {} from {} to {}", amount, asset, from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String asset, String holder) {
        return holdingRepository.findById(new HoldingKey(holder, asset))
            .map(AssetHolding::getBalance)
            .orElse(BigInteger.ZERO);
    }

    /**
     * Credit assets out of thin air. Helper for seeding balances.
     */
    @Transactional
    public void credit(String asset, String holder, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        AssetHolding target = findOrCreate(holder, asset);
        target.credit(amount);
        holdingRepository.save(target);
        log.info("Credited {} {} to {}", amount, asset, holder);
    }

    private AssetHolding findOrCreate(String holder, String asset) {
        return holdingRepository.findById(new HoldingKey(holder, asset))
            .orElseGet(() -> new AssetHolding(holder, asset));
    }
}
