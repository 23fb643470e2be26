package io.walletbridge.core;

import java.util.Objects;

/**
 * Unchecked failure of a bridge call, tagged with an {@link ErrorKind}.
 *
 * The message is what the page-side caller sees, e.g. "No wallet found".
 */
public class BridgeException extends RuntimeException {

    private final ErrorKind kind;

    public BridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public BridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static BridgeException timeout(String message) {
        return new BridgeException(ErrorKind.TIMEOUT, message);
    }

    public static BridgeException noWallet() {
        return new BridgeException(ErrorKind.NO_WALLET, "No wallet found");
    }

    public static BridgeException unknownMethod() {
        return new BridgeException(ErrorKind.UNKNOWN_METHOD, "Unknown request type");
    }

    public static BridgeException userRejected() {
        return new BridgeException(ErrorKind.USER_REJECTED, "User rejected the request");
    }

    public static BridgeException invalidParams(String message) {
        return new BridgeException(ErrorKind.INVALID_PARAMS, message);
    }
}
