package io.walletbridge.core.envelope;

import com.fasterxml.jackson.databind.JsonNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;

import java.util.Objects;

/**
 * Result half of an inbound envelope: either {@code Ok(value)} or
 * {@code Err(message)}. Exactly one of {@code value} / {@code error} is set.
 *
 * @param value success payload (host reply object), null for errors
 * @param error error message, null for success
 * @param code  optional {@link ErrorKind} name carried with an error
 */
public record Outcome(JsonNode value, String error, String code) {

    public Outcome {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value/error must be set");
        }
    }

    public static Outcome ok(JsonNode value) {
        return new Outcome(Objects.requireNonNull(value, "value"), null, null);
    }

    public static Outcome err(String message, ErrorKind kind) {
        Objects.requireNonNull(message, "message");
        return new Outcome(null, message, kind == null ? null : kind.name());
    }

    public boolean isOk() {
        return error == null;
    }

    /** Error view of this outcome; only valid when {@link #isOk()} is false. */
    public BridgeException toException() {
        if (isOk()) {
            throw new IllegalStateException("outcome is not an error");
        }
        return new BridgeException(ErrorKind.fromCode(code), error);
    }
}
