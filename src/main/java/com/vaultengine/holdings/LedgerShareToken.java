package com.vaultengine.holdings;

import com.vaultengine.common.UintMath;
import com.vaultengine.common.VaultErrorCode;
import com.vaultengine.common.VaultException;
import com.vaultengine.providers.ShareToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Share token backed by the local database.
 *
 * Balances live in the same transaction as the redemption ledger, so a failed
 * operation rolls back share movements together with ledger changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerShareToken implements ShareToken {

    private final ShareHoldingRepository holdingRepository;

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String holder) {
        return holdingRepository.findById(holder)
            .map(ShareHolding::getBalance)
            .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger totalSupply() {
        BigInteger supply = holdingRepository.sumBalances();
        return supply == null ? BigInteger.ZERO : supply;
    }

    @Override
    @Transactional
    public void transfer(String from, String to, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        ShareHolding source = holdingRepository.findById(from)
            .orElseThrow(() -> new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE,
                "No shares held by " + from));
        source.debit(amount);
        holdingRepository.save(source);

        ShareHolding target = findOrCreate(to);
        target.credit(amount);
        holdingRepository.save(target);

        log.debug("Share transfer {} -> {}: {}", from, to, amount);
    }

    @Override
    @Transactional
    public void mint(String to, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        UintMath.checkedAdd(totalSupply(), amount, UintMath.MAX_UINT256, VaultErrorCode.ARITHMETIC_OVERFLOW);

        ShareHolding target = findOrCreate(to);
        target.credit(amount);
        holdingRepository.save(target);

        log.info("Minted {} shares to {}", amount, to);
    }

    @Override
    @Transactional
    public void burn(String from, BigInteger amount) {
        UintMath.requireUint(amount, "amount");
        ShareHolding source = holdingRepository.findById(from)
            .orElseThrow(() -> new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE,
                "No shares held by " + from));
        source.debit(amount);
        holdingRepository.save(source);

        log.info("Burned {} shares from {}", amount, from);
    }

    private ShareHolding findOrCreate(String holder) {
        return holdingRepository.findById(holder).orElseGet(() -> new ShareHolding(holder));
    }
}
