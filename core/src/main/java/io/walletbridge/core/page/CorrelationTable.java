package io.walletbridge.core.page;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Correlation table of one {@link WalletProvider}: correlation id -> pending entry.
 *
 * Semantics:
 *  - register(id, entry): adds an entry; a duplicate id is a programming error.
 *  - resolve / reject: atomically remove the entry and settle it.
 *      * returns true  if this call removed the entry (first writer);
 *      * returns false if the id is unknown or was already removed.
 *
 * The response path and the deadline path race on the same id. Both go through
 * {@link ConcurrentHashMap#remove(Object)}, so exactly one of them observes the
 * entry and the other becomes a no-op.
 */
public final class CorrelationTable {

    private final Map<Long, PendingEntry> pending = new ConcurrentHashMap<>();

    public void register(long id, PendingEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (pending.putIfAbsent(id, entry) != null) {
            throw new IllegalStateException("correlation id already registered: " + id);
        }
    }

    public boolean resolve(long id, JsonNode value) {
        PendingEntry e = pending.remove(id);
        if (e == null) {
            return false;
        }
        e.settle(value);
        return true;
    }

    public boolean reject(long id, Throwable error) {
        PendingEntry e = pending.remove(id);
        if (e == null) {
            return false;
        }
        e.fail(error);
        return true;
    }

    /** Reject every pending entry; used when the owning provider closes. */
    public int rejectAll(Throwable error) {
        int n = 0;
        for (Long id : List.copyOf(pending.keySet())) {
            if (reject(id, error)) {
                n++;
            }
        }
        return n;
    }

    public boolean contains(long id) {
        return pending.containsKey(id);
    }

    public int size() {
        return pending.size();
    }
}
