package io.walletbridge.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Page -> relay envelope.
 * Wire shape:
 *   {
 *     "tag": "provider-request",
 *     "id": 7,
 *     "method": "GET_BALANCE",
 *     "params": ["0xabc"],
 *     "deadline": 1718000030000
 *   }
 *
 * {@code deadline} is optional: the epoch millis after which the page no
 * longer waits for a reply. Null when absent.
 */
public record OutboundRequest(long id, String method, List<JsonNode> params, Instant deadline) {

    public OutboundRequest {
        if (id <= 0) throw new IllegalArgumentException("id must be > 0");
        Objects.requireNonNull(method, "method");
        if (method.isBlank()) throw new IllegalArgumentException("method must not be blank");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public OutboundRequest(long id, String method, List<JsonNode> params) {
        this(id, method, params, null);
    }
}
