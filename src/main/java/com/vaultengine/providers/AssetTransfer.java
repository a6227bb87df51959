package com.vaultengine.providers;

import java.math.BigInteger;

/**
 * Asset movement collaborator.
 *
 * Implementations must fail loudly on insufficient balance; a silent no-op would
 * break conservation.
 */
public interface AssetTransfer {

    /**
     * Transfer {@code amount} of {@code asset} from the vault account to {@code to}.
     */
    void transfer(String asset, String to, BigInteger amount);

    /**
     * Transfer {@code amount} of {@code asset} between two arbitrary holders.
     */
    void transferFrom(String asset, String from, String to, BigInteger amount);

    BigInteger balanceOf(String asset, String holder);
}
