package io.walletbridge.server;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.server.handler.CapabilityHandler;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Privileged side of the bridge: owns the dispatch table of capability handlers.
 *
 * Contract of {@link #dispatch}:
 *  - exactly one reply per call, always delivered through normal completion;
 *  - reply is the handler's success object, or {@code {error, code}};
 *  - unknown methods reply UNKNOWN_METHOD ("Unknown request type");
 *  - handler exceptions, sync or async, become error replies (never dropped);
 *  - cancelling the returned future cancels the handler's pending work.
 *
 * Handlers run asynchronously; a handler waiting on user confirmation does not
 * hold up replies to other calls.
 */
public final class PrivilegedHost {
    private static final Logger log = Logger.getLogger(PrivilegedHost.class.getName());

    private final Map<String, CapabilityHandler> handlers;

    public PrivilegedHost(Collection<? extends CapabilityHandler> handlers) {
        Objects.requireNonNull(handlers, "handlers");
        Map<String, CapabilityHandler> table = new LinkedHashMap<>();
        for (CapabilityHandler h : handlers) {
            if (table.putIfAbsent(h.method(), h) != null) {
                throw new IllegalArgumentException("duplicate handler for method " + h.method());
            }
        }
        this.handlers = Map.copyOf(table);
    }

    public Set<String> methods() {
        return handlers.keySet();
    }

    public CompletableFuture<ObjectNode> dispatch(ForwardedCall call) {
        Objects.requireNonNull(call, "call");
        CapabilityHandler handler = handlers.get(call.type());
        if (handler == null) {
            log.info(() -> "no handler for method " + call.type() + " (id=" + call.correlationId() + ")");
            return CompletableFuture.completedFuture(errorReply(BridgeException.unknownMethod()));
        }

        CompletableFuture<ObjectNode> result;
        try {
            result = handler.handle(call);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ObjectNode> work = result;
        CompletableFuture<ObjectNode> replyFuture = work.handle((reply, err) -> {
            if (err == null && reply != null) {
                return reply;
            }
            Throwable cause = err == null
                    ? new IllegalStateException("handler returned no reply")
                    : unwrap(err);
            if (cause instanceof BridgeException be) {
                log.fine(() -> call.type() + " id=" + call.correlationId() + " -> " + be.kind());
            } else {
                log.log(Level.WARNING, "handler " + call.type() + " failed for id=" + call.correlationId(), cause);
            }
            return errorReply(cause);
        });
        replyFuture.whenComplete((reply, err) -> {
            if (replyFuture.isCancelled()) {
                log.fine(() -> call.type() + " id=" + call.correlationId() + " cancelled by caller");
                work.cancel(false);
            }
        });
        return replyFuture;
    }

    static ObjectNode errorReply(Throwable error) {
        ErrorKind kind = error instanceof BridgeException be ? be.kind() : ErrorKind.HOST_FAILURE;
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        ObjectNode reply = JsonNodeFactory.instance.objectNode();
        reply.put("error", message);
        reply.put("code", kind.name());
        return reply;
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
