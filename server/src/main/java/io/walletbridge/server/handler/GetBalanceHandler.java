package io.walletbridge.server.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.server.rpc.RpcNetworkClient;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * GET_BALANCE [address] -> {@code {balance}}.
 * RPC failures surface as NETWORK_ERROR from the client.
 */
public final class GetBalanceHandler implements CapabilityHandler {

    private final RpcNetworkClient rpc;

    public GetBalanceHandler(RpcNetworkClient rpc) {
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    @Override
    public String method() {
        return CapabilityMethods.GET_BALANCE;
    }

    @Override
    public CompletableFuture<ObjectNode> handle(ForwardedCall call) {
        JsonNode address = call.param(0);
        if (address == null || !address.isTextual() || address.asText().isBlank()) {
            throw BridgeException.invalidParams("address is required");
        }
        return rpc.getBalance(address.asText()).thenApply(balance -> {
            ObjectNode reply = JsonNodeFactory.instance.objectNode();
            reply.put("balance", balance);
            return reply;
        });
    }
}
