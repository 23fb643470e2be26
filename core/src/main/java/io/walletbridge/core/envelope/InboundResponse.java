package io.walletbridge.core.envelope;

import java.util.Objects;

/**
 * Relay -> page envelope.
 * Wire shape:
 *   { "tag": "provider-response", "id": 7, "result": { "balance": "100" } }
 *   { "tag": "provider-response", "id": 7, "result": { "error": "No wallet found", "code": "NO_WALLET" } }
 */
public record InboundResponse(long id, Outcome outcome) {

    public InboundResponse {
        if (id <= 0) throw new IllegalArgumentException("id must be > 0");
        Objects.requireNonNull(outcome, "outcome");
    }
}
