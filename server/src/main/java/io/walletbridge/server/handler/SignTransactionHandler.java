package io.walletbridge.server.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.server.confirm.ConfirmationGateway;
import io.walletbridge.server.rpc.RpcNetworkClient;
import io.walletbridge.storage.WalletKeyStore;
import io.walletbridge.storage.WalletRecord;

import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * SIGN_TRANSACTION [tx] -> signed transaction.
 *
 * Steps:
 *  1) Load the wallet (NO_WALLET if none).
 *  2) Build the unsigned transaction: stamp timestamp and nonce.
 *  3) Ask the confirmation gateway, keyed by the caller's correlation id.
 *     The host reply is held back until the user decides; other calls keep
 *     being served meanwhile.
 *  4) On approval sign the transaction digest through the key store.
 *  5) Optionally broadcast via RPC and attach the returned hash.
 *
 * Rejection -> USER_REJECTED; confirmation timeout -> TIMEOUT.
 * The confirmation is bounded by the call's deadline, and cancelling the
 * returned future withdraws it.
 */
public final class SignTransactionHandler implements CapabilityHandler {
    private static final Logger log = Logger.getLogger(SignTransactionHandler.class.getName());

    private final WalletKeyStore keyStore;
    private final ConfirmationGateway confirmations;
    private final NonceSource nonces;
    private final RpcNetworkClient rpc;
    private final boolean broadcast;
    private final Clock clock;

    public SignTransactionHandler(
            WalletKeyStore keyStore,
            ConfirmationGateway confirmations,
            NonceSource nonces,
            RpcNetworkClient rpc,
            boolean broadcast,
            Clock clock
    ) {
        this.keyStore = Objects.requireNonNull(keyStore, "keyStore");
        this.confirmations = Objects.requireNonNull(confirmations, "confirmations");
        this.nonces = Objects.requireNonNull(nonces, "nonces");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
        this.broadcast = broadcast;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String method() {
        return CapabilityMethods.SIGN_TRANSACTION;
    }

    @Override
    public CompletableFuture<ObjectNode> handle(ForwardedCall call) {
        WalletRecord wallet = keyStore.loadWallet().orElseThrow(BridgeException::noWallet);
        UnsignedTransaction tx = UnsignedTransaction.fromRequest(
                call.param(0),
                wallet.address(),
                clock.instant().getEpochSecond(),
                nonces.nextNonce(wallet.address())
        );

        CompletableFuture<Boolean> approval =
                confirmations.requestApproval(call.correlationId(), call.origin(), tx.toJson(), call.deadline());
        CompletableFuture<ObjectNode> result = approval
                .thenCompose(approved -> {
                    if (!approved) {
                        log.info(() -> "signature for id=" + call.correlationId() + " rejected by user");
                        throw BridgeException.userRejected();
                    }
                    ObjectNode signed = sign(tx, wallet);
                    if (!broadcast) {
                        return CompletableFuture.completedFuture(signed);
                    }
                    return rpc.sendTransaction(signed).thenApply(hash -> signed.put("hash", hash));
                });
        result.whenComplete((reply, err) -> {
            if (result.isCancelled()) {
                approval.cancel(false);
            }
        });
        return result;
    }

    private ObjectNode sign(UnsignedTransaction tx, WalletRecord wallet) {
        byte[] signature = keyStore.sign(tx.digest(), wallet);
        ObjectNode signed = tx.toJson();
        signed.put("signature", HexFormat.of().formatHex(signature));
        signed.put("publicKey", wallet.publicKeyHex());
        return signed;
    }
}
