package io.walletbridge.storage;

import java.util.Optional;

/**
 * Capability contract the privileged host needs from wallet storage.
 *
 * How keys are generated, derived or persisted is the store's business; the
 * bridge only reads the wallet and asks for signatures over digests.
 */
public interface WalletKeyStore {

    /** True if a wallet is configured. */
    boolean hasWallet();

    /** The configured wallet, or empty when there is none. */
    Optional<WalletRecord> loadWallet();

    /**
     * Sign a digest with the wallet's private material.
     *
     * @return opaque signature bytes
     */
    byte[] sign(byte[] digest, WalletRecord wallet);
}
