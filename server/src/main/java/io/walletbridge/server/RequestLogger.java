package io.walletbridge.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the host's HTTP surface.
 *
 * Central place to log method/path/status and latency.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method      HTTP method (GET, POST, etc.)
     * @param path        request path
     * @param status      HTTP status code
     * @param totalMillis wall-clock latency for the whole request
     * @param error       optional exception (for 5xx logging), null if none
     */
    public static void logRequest(String method, String path, int status, long totalMillis, Throwable error) {
        String msg = String.format("HTTP %s %s -> %d (total=%dms)", method, path, status, totalMillis);

        if (error != null && status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (status >= 500) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
