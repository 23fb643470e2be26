package io.walletbridge.server.confirm;

import com.fasterxml.jackson.databind.JsonNode;
import io.walletbridge.core.BridgeException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * In-memory queue of pending signature confirmations.
 *
 * Semantics:
 *  - requestApproval() files a ticket and returns a future for the decision;
 *  - approve()/reject() decide a ticket; the timeout decides it otherwise;
 *  - every decision path removes the ticket with one atomic remove, so a
 *    ticket is decided exactly once and late decisions return false;
 *  - a ticket expires at the earlier of the queue timeout and the caller's
 *    deadline, and a decision arriving at or after that instant is refused;
 *  - cancelling the returned future withdraws the ticket.
 *
 * Each pending ticket is an independent task: deciding or waiting on one never
 * blocks the host from serving other calls.
 */
public final class ConfirmationQueue implements ConfirmationGateway, AutoCloseable {
    private static final Logger log = Logger.getLogger(ConfirmationQueue.class.getName());

    private final Duration timeout;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public ConfirmationQueue(Duration timeout) {
        this(timeout, Clock.systemUTC());
    }

    public ConfirmationQueue(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.timeout = timeout;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "confirmation-timeouts");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Boolean> requestApproval(
            long correlationId,
            String origin,
            JsonNode transaction,
            Instant deadline
    ) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(timeout);
        if (deadline != null && deadline.isBefore(expiresAt)) {
            expiresAt = deadline;
        }
        var ticket = new ConfirmationTicket(
                UUID.randomUUID().toString(),
                correlationId,
                origin,
                transaction,
                now,
                expiresAt
        );
        var p = new Pending(ticket);
        pending.put(ticket.ticketId(), p);
        p.decision.whenComplete((approved, err) -> {
            if (p.decision.isCancelled()) {
                withdraw(p);
            }
        });
        long delayMillis = Math.max(0, Duration.between(now, expiresAt).toMillis());
        p.timer = scheduler.schedule(() -> expire(ticket.ticketId()), delayMillis, TimeUnit.MILLISECONDS);

        log.info(() -> "confirmation " + ticket.ticketId() + " opened for " + origin + " id=" + correlationId
                + ", expires " + ticket.expiresAt());
        return p.decision;
    }

    public boolean approve(String ticketId) {
        return decide(ticketId, true);
    }

    public boolean reject(String ticketId) {
        return decide(ticketId, false);
    }

    /** Pending tickets, oldest first. */
    public List<ConfirmationTicket> pending() {
        return pending.values().stream()
                .map(p -> p.ticket)
                .sorted(Comparator.comparing(ConfirmationTicket::createdAt))
                .toList();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        for (String id : List.copyOf(pending.keySet())) {
            Pending p = pending.remove(id);
            if (p != null) {
                p.decision.completeExceptionally(BridgeException.timeout("Confirmation surface closed"));
            }
        }
    }

    private boolean decide(String ticketId, boolean approved) {
        Pending p = ticketId == null ? null : pending.remove(ticketId);
        if (p == null) {
            return false;
        }
        p.cancelTimer();
        if (!clock.instant().isBefore(p.ticket.expiresAt())) {
            log.info(() -> "confirmation " + ticketId + " decided after it expired");
            p.decision.completeExceptionally(BridgeException.timeout("Confirmation timed out"));
            return false;
        }
        log.info(() -> "confirmation " + ticketId + (approved ? " approved" : " rejected"));
        p.decision.complete(approved);
        return true;
    }

    private void expire(String ticketId) {
        Pending p = pending.remove(ticketId);
        if (p != null) {
            log.info(() -> "confirmation " + ticketId + " timed out");
            p.decision.completeExceptionally(BridgeException.timeout("Confirmation timed out"));
        }
    }

    private void withdraw(Pending p) {
        String ticketId = p.ticket.ticketId();
        if (pending.remove(ticketId, p)) {
            p.cancelTimer();
            log.info(() -> "confirmation " + ticketId + " withdrawn, caller stopped waiting");
        }
    }

    private static final class Pending {
        final ConfirmationTicket ticket;
        final CompletableFuture<Boolean> decision = new CompletableFuture<>();
        volatile ScheduledFuture<?> timer;

        Pending(ConfirmationTicket ticket) {
            this.ticket = ticket;
        }

        void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
