package io.walletbridge.core.channel;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process model of a page window's shared message channel.
 *
 * Every listener sees every message, including traffic that has nothing to do
 * with the bridge. Messages posted through {@link #postMessage(JsonNode)} carry
 * this channel as their source and its origin; {@link #deliverFrom} injects
 * messages from other contexts (iframes, other extensions, scripts).
 *
 * Delivery is synchronous on the posting thread. Each listener receives its
 * own deep copy of the payload, like a structured clone, so no listener can
 * alter what the poster or another listener sees. A listener that throws is
 * logged and skipped; the remaining listeners still run.
 */
public final class WindowChannel {
    private static final Logger log = Logger.getLogger(WindowChannel.class.getName());

    private final String origin;
    private final List<Consumer<MessageEvent>> listeners = new CopyOnWriteArrayList<>();

    public WindowChannel(String origin) {
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public String origin() {
        return origin;
    }

    public void subscribe(Consumer<MessageEvent> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(Consumer<MessageEvent> listener) {
        listeners.remove(listener);
    }

    /** Post from the window itself (same source, same origin). */
    public void postMessage(JsonNode data) {
        dispatch(this, origin, data);
    }

    /** Deliver a message that originated in another context. */
    public void deliverFrom(Object source, String sourceOrigin, JsonNode data) {
        dispatch(source, sourceOrigin, data);
    }

    private void dispatch(Object source, String sourceOrigin, JsonNode data) {
        for (Consumer<MessageEvent> l : listeners) {
            JsonNode copy = data == null ? null : data.deepCopy();
            try {
                l.accept(new MessageEvent(source, sourceOrigin, copy));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "channel listener failed on message from " + sourceOrigin, e);
            }
        }
    }
}
