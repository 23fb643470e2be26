package io.walletbridge.server.confirm;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A signature request waiting for a user decision. No decision is accepted at
 * or after {@code expiresAt}.
 */
public record ConfirmationTicket(
        String ticketId,
        long correlationId,
        String origin,
        JsonNode transaction,
        Instant createdAt,
        Instant expiresAt
) {
}
