package io.walletbridge.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.walletbridge.server.confirm.ConfirmationQueue;
import io.walletbridge.server.confirm.ConfirmationTicket;
import io.walletbridge.server.dto.ConfirmationView;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin HTTP adapter over the {@link ConfirmationQueue}: the non-visual side of
 * the confirmation surface. A UI (or an operator with curl) lists pending
 * signature requests and decides them here.
 *
 * Path layout:
 *   - GET  /confirmations                      Pending tickets, oldest first
 *   - POST /confirmations/{ticketId}/approve   Approve a ticket
 *   - POST /confirmations/{ticketId}/reject    Reject a ticket
 *   - GET  /admin/health                       Basic health check
 *
 * Deciding an unknown (or already decided / timed out) ticket -> 404.
 */
public final class ConfirmationWebServer {
    private static final String PREFIX = "/confirmations";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ConfirmationQueue confirmations;

    public ConfirmationWebServer(int port, ConfirmationQueue confirmations) {
        this.confirmations = Objects.requireNonNull(confirmations, "confirmations");

        this.server = Undertow.builder()
                .addHttpListener(port, "127.0.0.1")
                .setHandler(exchange -> {
                    long start = System.nanoTime();
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    int status;
                    Throwable error = null;
                    try {
                        status = route(exchange, method, path);
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName(),
                                "message", String.valueOf(e.getMessage())));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest(method, path, status, totalMs, error);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private int route(HttpServerExchange ex, String method, String path) {
        if ("/admin/health".equals(path)) {
            return send(ex, 200, Map.of("status", "ok"));
        }
        if (PREFIX.equals(path) || (PREFIX + "/").equals(path)) {
            if (!"GET".equals(method)) {
                return send(ex, 405, Map.of("error", "method not allowed"));
            }
            return send(ex, 200, listPending());
        }
        if (path.startsWith(PREFIX + "/")) {
            String[] parts = path.substring(PREFIX.length() + 1).split("/");
            if (parts.length != 2 || parts[0].isBlank()) {
                return send(ex, 404, Map.of("error", "not found"));
            }
            if (!"POST".equals(method)) {
                return send(ex, 405, Map.of("error", "method not allowed"));
            }
            return switch (parts[1]) {
                case "approve" -> decide(ex, parts[0], true);
                case "reject" -> decide(ex, parts[0], false);
                default -> send(ex, 404, Map.of("error", "not found"));
            };
        }
        return send(ex, 404, Map.of("error", "not found"));
    }

    // ---------- handlers ----------

    private List<ConfirmationView> listPending() {
        List<ConfirmationTicket> tickets = confirmations.pending();
        List<ConfirmationView> views = new ArrayList<>(tickets.size());
        for (ConfirmationTicket t : tickets) {
            var v = new ConfirmationView();
            v.ticketId = t.ticketId();
            v.correlationId = t.correlationId();
            v.origin = t.origin();
            v.transaction = t.transaction();
            v.createdAtMillis = t.createdAt().toEpochMilli();
            v.expiresAtMillis = t.expiresAt().toEpochMilli();
            views.add(v);
        }
        return views;
    }

    private int decide(HttpServerExchange ex, String ticketId, boolean approve) {
        boolean decided = approve ? confirmations.approve(ticketId) : confirmations.reject(ticketId);
        if (!decided) {
            return send(ex, 404, Map.of("error", "no pending confirmation " + ticketId));
        }
        return send(ex, 200, Map.of("ticketId", ticketId, "approved", approve));
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private int send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
            return code;
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            return 500;
        }
    }
}
