package io.walletbridge.server.handler;

import java.security.SecureRandom;

/**
 * Random nonce in [0, 1_000_000), the wallet's historical behaviour.
 */
// TODO: replace with an account nonce read from the chain once the node exposes one over RPC.
public final class RandomNonceSource implements NonceSource {

    static final long BOUND = 1_000_000L;

    private final SecureRandom random = new SecureRandom();

    @Override
    public long nextNonce(String fromAddress) {
        return random.nextInt((int) BOUND);
    }
}
