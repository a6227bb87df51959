package com.vaultengine.providers;

import java.math.BigInteger;

/**
 * The vault's share token: balances, supply, mint and burn.
 */
public interface ShareToken {

    BigInteger balanceOf(String holder);

    BigInteger totalSupply();

    /**
     * Move shares between holders.
     *
     * @throws com.vaultengine.common.VaultException with INSUFFICIENT_BALANCE if {@code from} holds too few
     */
    void transfer(String from, String to, BigInteger amount);

    void mint(String to, BigInteger amount);

    void burn(String from, BigInteger amount);
}
