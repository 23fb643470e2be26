package io.walletbridge.core;

/**
 * Failure categories that can travel across the bridge.
 *
 * The wire form is the enum name, carried in the {@code code} field of an
 * error reply. MALFORMED_MESSAGE is never sent over the wire: malformed
 * channel traffic is dropped without a reply.
 */
public enum ErrorKind {
    TIMEOUT,
    UNKNOWN_METHOD,
    NO_WALLET,
    USER_REJECTED,
    NETWORK_ERROR,
    MALFORMED_MESSAGE,
    INVALID_PARAMS,
    HOST_FAILURE;

    /**
     * Parse a wire code. Null, blank, or unrecognised codes map to
     * {@link #HOST_FAILURE} so a newer host cannot break an older page.
     */
    public static ErrorKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            return HOST_FAILURE;
        }
        try {
            return ErrorKind.valueOf(code.trim());
        } catch (IllegalArgumentException unknown) {
            return HOST_FAILURE;
        }
    }
}
