package io.walletbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.server.rpc.RpcNetworkClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Scripted chain node: fixed balances, records broadcasts, optionally offline. */
public final class FakeRpcClient implements RpcNetworkClient {
    public final Map<String, String> balances = new ConcurrentHashMap<>();
    public final List<JsonNode> broadcasts = new CopyOnWriteArrayList<>();
    public volatile boolean offline;

    @Override
    public CompletableFuture<String> getBalance(String address) {
        if (offline) {
            return CompletableFuture.failedFuture(
                    new BridgeException(ErrorKind.NETWORK_ERROR, "HTTP error! status: 503"));
        }
        return CompletableFuture.completedFuture(balances.getOrDefault(address, "0"));
    }

    @Override
    public CompletableFuture<String> sendTransaction(JsonNode signedTx) {
        if (offline) {
            return CompletableFuture.failedFuture(
                    new BridgeException(ErrorKind.NETWORK_ERROR, "HTTP error! status: 503"));
        }
        broadcasts.add(signedTx.deepCopy());
        return CompletableFuture.completedFuture("0xhash" + broadcasts.size());
    }
}
