package io.walletbridge.server.handler;

/**
 * Supplies the nonce stamped on a transaction before signing.
 */
@FunctionalInterface
public interface NonceSource {
    long nextNonce(String fromAddress);
}
