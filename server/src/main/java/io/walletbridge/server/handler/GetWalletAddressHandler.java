package io.walletbridge.server.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.storage.WalletKeyStore;
import io.walletbridge.storage.WalletRecord;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/** GET_WALLET_ADDRESS -> {@code {address}} or NO_WALLET. */
public final class GetWalletAddressHandler implements CapabilityHandler {

    private final WalletKeyStore keyStore;

    public GetWalletAddressHandler(WalletKeyStore keyStore) {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
    }

    @Override
    public String method() {
        return CapabilityMethods.GET_WALLET_ADDRESS;
    }

    @Override
    public CompletableFuture<ObjectNode> handle(ForwardedCall call) {
        WalletRecord wallet = keyStore.loadWallet().orElseThrow(BridgeException::noWallet);
        ObjectNode reply = JsonNodeFactory.instance.objectNode();
        reply.put("address", wallet.address());
        return CompletableFuture.completedFuture(reply);
    }
}
