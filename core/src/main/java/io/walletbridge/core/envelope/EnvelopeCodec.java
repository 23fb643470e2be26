package io.walletbridge.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.ErrorKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts between untyped channel payloads ({@link JsonNode}) and the two
 * envelope variants.
 *
 * Decoding is strict at the boundary: a payload that does not match a variant
 * exactly (wrong tag, missing or non-integral id, blank method, non-array
 * params, non-integral deadline, missing result) decodes to
 * {@link Optional#empty()}. Callers drop those silently; the shared channel
 * carries traffic from other systems too.
 *
 * Encoding deep-copies caller-supplied nodes, so an envelope on the channel
 * never aliases an object the caller still holds.
 */
public final class EnvelopeCodec {

    public static final String OUTBOUND_TAG = "provider-request";
    public static final String INBOUND_TAG = "provider-response";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EnvelopeCodec() {
        // utility
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    // ---------- outbound ----------

    public static JsonNode encode(OutboundRequest req) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("tag", OUTBOUND_TAG);
        node.put("id", req.id());
        node.put("method", req.method());
        ArrayNode params = node.putArray("params");
        for (JsonNode p : req.params()) {
            JsonNode copy = p.deepCopy();
            params.add(copy);
        }
        if (req.deadline() != null) {
            node.put("deadline", req.deadline().toEpochMilli());
        }
        return node;
    }

    public static Optional<OutboundRequest> decodeOutbound(JsonNode data) {
        if (!hasTag(data, OUTBOUND_TAG)) {
            return Optional.empty();
        }
        Long id = readId(data);
        JsonNode method = data.get("method");
        if (id == null || method == null || !method.isTextual() || method.asText().isBlank()) {
            return Optional.empty();
        }

        JsonNode params = data.get("params");
        List<JsonNode> list = new ArrayList<>();
        if (params != null && !params.isNull()) {
            if (!params.isArray()) {
                return Optional.empty();
            }
            params.forEach(list::add);
        }

        Instant deadline = null;
        JsonNode d = data.get("deadline");
        if (d != null && !d.isNull()) {
            if (!d.isIntegralNumber() || !d.canConvertToLong() || d.asLong() <= 0) {
                return Optional.empty();
            }
            deadline = Instant.ofEpochMilli(d.asLong());
        }
        return Optional.of(new OutboundRequest(id, method.asText(), list, deadline));
    }

    // ---------- inbound ----------

    public static JsonNode encode(InboundResponse resp) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("tag", INBOUND_TAG);
        node.put("id", resp.id());

        Outcome outcome = resp.outcome();
        if (outcome.isOk()) {
            node.set("result", outcome.value().deepCopy());
        } else {
            ObjectNode err = node.putObject("result");
            err.put("error", outcome.error());
            if (outcome.code() != null) {
                err.put("code", outcome.code());
            }
        }
        return node;
    }

    public static Optional<InboundResponse> decodeInbound(JsonNode data) {
        if (!hasTag(data, INBOUND_TAG)) {
            return Optional.empty();
        }
        Long id = readId(data);
        JsonNode result = data.get("result");
        if (id == null || result == null || result.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(new InboundResponse(id, toOutcome(result)));
    }

    /**
     * Interpret a host reply object: a textual {@code error} field means
     * failure, anything else is the success value.
     */
    public static Outcome toOutcome(JsonNode reply) {
        JsonNode error = reply.get("error");
        if (error != null && !error.isNull()) {
            JsonNode code = reply.get("code");
            ErrorKind kind = code != null && code.isTextual() ? ErrorKind.fromCode(code.asText()) : null;
            return Outcome.err(error.asText(), kind);
        }
        return Outcome.ok(reply);
    }

    // ---------- helpers ----------

    private static boolean hasTag(JsonNode data, String tag) {
        if (data == null || !data.isObject()) {
            return false;
        }
        JsonNode t = data.get("tag");
        return t != null && t.isTextual() && tag.equals(t.asText());
    }

    /** Positive integral id or null. */
    private static Long readId(JsonNode data) {
        JsonNode id = data.get("id");
        if (id == null || !id.isIntegralNumber() || !id.canConvertToLong()) {
            return null;
        }
        long v = id.asLong();
        return v > 0 ? v : null;
    }
}
