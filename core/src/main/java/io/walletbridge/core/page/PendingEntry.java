package io.walletbridge.core.page;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Page-side record of one in-flight request.
 *
 * The future is the caller's continuation; the timer is the deadline owned
 * 1:1 by this entry and cancelled as soon as the entry settles.
 */
public final class PendingEntry {

    private final long id;
    private final String method;
    private final Instant createdAt;
    private final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    public PendingEntry(long id, String method, Instant createdAt) {
        this.id = id;
        this.method = method;
        this.createdAt = createdAt;
    }

    public long id() {
        return id;
    }

    public String method() {
        return method;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public CompletableFuture<JsonNode> future() {
        return future;
    }

    /**
     * Attach the deadline timer. If the entry already settled (a fast response
     * can beat this call), the timer is cancelled right away.
     */
    void attachTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (future.isDone()) {
            timer.cancel(false);
        }
    }

    void settle(JsonNode value) {
        cancelTimer();
        future.complete(value);
    }

    void fail(Throwable error) {
        cancelTimer();
        future.completeExceptionally(error);
    }

    private void cancelTimer() {
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
    }
}
