package io.walletbridge.server.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.relay.ForwardedCall;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Replies with a single configured chain property, e.g. {@code {chainId: "0x1d69"}}.
 */
public final class ChainInfoHandler implements CapabilityHandler {

    private final String method;
    private final String field;
    private final String value;

    public ChainInfoHandler(String method, String field, String value) {
        this.method = Objects.requireNonNull(method, "method");
        this.field = Objects.requireNonNull(field, "field");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static ChainInfoHandler chainId(String chainId) {
        return new ChainInfoHandler(CapabilityMethods.GET_CHAIN_ID, "chainId", chainId);
    }

    public static ChainInfoHandler networkVersion(String networkVersion) {
        return new ChainInfoHandler(CapabilityMethods.GET_NETWORK_VERSION, "networkVersion", networkVersion);
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public CompletableFuture<ObjectNode> handle(ForwardedCall call) {
        ObjectNode reply = JsonNodeFactory.instance.objectNode();
        reply.put(field, value);
        return CompletableFuture.completedFuture(reply);
    }
}
