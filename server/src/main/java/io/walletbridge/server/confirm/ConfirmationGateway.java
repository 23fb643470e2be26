package io.walletbridge.server.confirm;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Seam to the confirmation surface that asks the user before signing.
 */
public interface ConfirmationGateway {

    /**
     * Ask the user to approve {@code transaction}.
     *
     * @param correlationId page correlation id of the originating request
     * @param origin        page origin the request came from
     * @param deadline      instant after which the page no longer waits, or null
     * @return completes true (approved) or false (rejected); fails with a
     *         TIMEOUT {@link io.walletbridge.core.BridgeException} if nobody decides in time.
     *         Cancelling it withdraws the request.
     */
    CompletableFuture<Boolean> requestApproval(long correlationId, String origin, JsonNode transaction, Instant deadline);
}
