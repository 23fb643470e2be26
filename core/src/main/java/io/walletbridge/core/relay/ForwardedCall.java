package io.walletbridge.core.relay;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Relay -> host call. Carries the page's method name as {@code type} plus its
 * params.
 *
 * The host never correlates replies by {@code correlationId}; the relay's
 * callback does that. The host only uses it (with {@code origin}) to key
 * confirmation tasks and in logs.
 *
 * {@code deadline} is the instant after which the page has stopped waiting,
 * or null when the page sent none. Work that outlives it (a pending user
 * confirmation) must be abandoned.
 */
public record ForwardedCall(String type, long correlationId, String origin, List<JsonNode> params, Instant deadline) {

    public ForwardedCall {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(origin, "origin");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public ForwardedCall(String type, long correlationId, String origin, List<JsonNode> params) {
        this(type, correlationId, origin, params, null);
    }

    /** Param at {@code index}, or null when absent or JSON null. */
    public JsonNode param(int index) {
        if (index < 0 || index >= params.size()) {
            return null;
        }
        JsonNode p = params.get(index);
        return p == null || p.isNull() ? null : p;
    }
}
