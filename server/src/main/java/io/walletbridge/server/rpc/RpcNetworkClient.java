package io.walletbridge.server.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Client for the blockchain node the host talks to.
 *
 * Futures fail with a NETWORK_ERROR {@link io.walletbridge.core.BridgeException}
 * on transport or RPC-level errors.
 */
public interface RpcNetworkClient {

    /** Balance in base units, as a decimal string. */
    CompletableFuture<String> getBalance(String address);

    /** Submit a signed transaction; returns its hash. */
    CompletableFuture<String> sendTransaction(JsonNode signedTx);
}
