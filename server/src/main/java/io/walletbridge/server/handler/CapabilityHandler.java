package io.walletbridge.server.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.relay.ForwardedCall;

import java.util.concurrent.CompletableFuture;

/**
 * One entry of the privileged host's dispatch table.
 *
 * A handler either completes its future with a success reply object or fails
 * it (ideally with a {@link io.walletbridge.core.BridgeException}); the host
 * turns failures into {@code {error, code}} replies.
 */
public interface CapabilityHandler {

    /** Method name this handler is registered under. */
    String method();

    CompletableFuture<ObjectNode> handle(ForwardedCall call);
}
