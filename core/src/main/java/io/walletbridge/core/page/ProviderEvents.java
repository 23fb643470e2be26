package io.walletbridge.core.page;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observer registry behind {@code WalletProvider.on/removeListener}:
 * a set of subscribers per event name.
 */
final class ProviderEvents {
    private static final Logger log = Logger.getLogger(ProviderEvents.class.getName());

    private final Map<String, Set<Consumer<Object>>> listeners = new ConcurrentHashMap<>();

    void on(String event, Consumer<Object> listener) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(listener, "listener");
        listeners.computeIfAbsent(event, k -> new CopyOnWriteArraySet<>()).add(listener);
    }

    void removeListener(String event, Consumer<Object> listener) {
        Set<Consumer<Object>> set = listeners.get(event);
        if (set != null) {
            set.remove(listener);
        }
    }

    int listenerCount(String event) {
        Set<Consumer<Object>> set = listeners.get(event);
        return set == null ? 0 : set.size();
    }

    void emit(String event, Object payload) {
        Set<Consumer<Object>> set = listeners.get(event);
        if (set == null) {
            return;
        }
        for (Consumer<Object> l : set) {
            try {
                l.accept(payload);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "listener for '" + event + "' failed", e);
            }
        }
    }
}
