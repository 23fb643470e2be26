package io.walletbridge.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Transaction as presented for confirmation and signing.
 *
 * Canonical form (field order is part of the digest):
 *   {"from":..., "to":..., "amount":"<decimal>", "purpose":..., "timestamp":<epoch s>, "nonce":<n>}
 */
public record UnsignedTransaction(
        String from,
        String to,
        String amount,
        String purpose,
        long timestamp,
        long nonce
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern AMOUNT = Pattern.compile("\\d+");

    public UnsignedTransaction {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(amount, "amount");
        purpose = purpose == null ? "" : purpose;
    }

    /**
     * Build from a page-supplied transaction object.
     *
     * Rules:
     *  - "to" is required;
     *  - "amount" is required, a non-negative integer given as number or string;
     *  - "from" defaults to the wallet address and must match it when present;
     *  - "purpose" defaults to "".
     *
     * @throws BridgeException INVALID_PARAMS when a rule is violated
     */
    public static UnsignedTransaction fromRequest(
            JsonNode tx,
            String walletAddress,
            long timestampSeconds,
            long nonce
    ) {
        if (tx == null || !tx.isObject()) {
            throw BridgeException.invalidParams("transaction object is required");
        }
        String to = text(tx, "to");
        if (to == null || to.isBlank()) {
            throw BridgeException.invalidParams("transaction.to is required");
        }

        JsonNode amountNode = tx.get("amount");
        String amount = null;
        if (amountNode != null && amountNode.isIntegralNumber()) {
            amount = amountNode.bigIntegerValue().toString();
        } else if (amountNode != null && amountNode.isTextual()) {
            amount = amountNode.asText().trim();
        }
        if (amount == null || !AMOUNT.matcher(amount).matches()) {
            throw BridgeException.invalidParams("transaction.amount must be a non-negative integer");
        }

        String from = text(tx, "from");
        if (from != null && !from.isBlank() && !from.equalsIgnoreCase(walletAddress)) {
            throw BridgeException.invalidParams("transaction.from does not match the wallet address");
        }

        return new UnsignedTransaction(walletAddress, to, amount, text(tx, "purpose"), timestampSeconds, nonce);
    }

    public ObjectNode toJson() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("from", from);
        node.put("to", to);
        node.put("amount", amount);
        node.put("purpose", purpose);
        node.put("timestamp", timestamp);
        node.put("nonce", nonce);
        return node;
    }

    /** SHA-256 over the canonical JSON bytes. */
    public byte[] digest() {
        try {
            byte[] canonical = MAPPER.writeValueAsBytes(toJson());
            return MessageDigest.getInstance("SHA-256").digest(canonical);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("cannot digest transaction", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
