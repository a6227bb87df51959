package com.vaultengine.providers;

/**
 * External pause flag. Request, fulfill and deposit paths honour it;
 * cancel, withdraw and redeem never do.
 */
public interface PauseGate {

    boolean isPaused();
}
