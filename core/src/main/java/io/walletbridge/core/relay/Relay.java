package io.walletbridge.core.relay;

import com.fasterxml.jackson.databind.JsonNode;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.channel.MessageEvent;
import io.walletbridge.core.channel.WindowChannel;
import io.walletbridge.core.envelope.EnvelopeCodec;
import io.walletbridge.core.envelope.InboundResponse;
import io.walletbridge.core.envelope.OutboundRequest;
import io.walletbridge.core.envelope.Outcome;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Trust boundary between the page channel and the privileged host.
 *
 * Filtering:
 *  - accept only messages posted by the window itself (same source and origin);
 *  - accept only well-formed outbound envelopes;
 *  - everything else is ignored without side effects.
 *
 * Forwarding:
 *  - each accepted envelope becomes one {@link ForwardedCall};
 *  - the reply callback closes over the correlation id and nothing else;
 *  - exactly one inbound envelope is posted per forwarded call, whatever the
 *    transport does (host error and transport failure become Err outcomes).
 *
 * The relay keeps no state between calls and never originates a request.
 */
public final class Relay implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Relay.class.getName());

    private final WindowChannel channel;
    private final HostTransport transport;
    private final Consumer<MessageEvent> listener = this::onMessage;

    public Relay(WindowChannel channel, HostTransport transport) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public void start() {
        channel.subscribe(listener);
    }

    @Override
    public void close() {
        channel.unsubscribe(listener);
    }

    private void onMessage(MessageEvent event) {
        if (event.source() != channel || !channel.origin().equals(event.origin())) {
            return;
        }
        Optional<OutboundRequest> decoded = EnvelopeCodec.decodeOutbound(event.data());
        if (decoded.isEmpty()) {
            return;
        }
        OutboundRequest req = decoded.get();
        log.fine(() -> "relay forwarding " + req.method() + " id=" + req.id());

        var call = new ForwardedCall(req.method(), req.id(), channel.origin(), req.params(), req.deadline());
        long id = req.id();
        AtomicBoolean answered = new AtomicBoolean();

        HostTransport.ReplyHandler handler = new HostTransport.ReplyHandler() {
            @Override
            public void onReply(JsonNode reply) {
                if (reply == null || !reply.isObject()) {
                    respond(id, answered, Outcome.err("Malformed host reply", ErrorKind.HOST_FAILURE));
                } else {
                    respond(id, answered, EnvelopeCodec.toOutcome(reply));
                }
            }

            @Override
            public void onFailure(Throwable error) {
                String msg = "Privileged host unavailable: "
                        + (error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
                respond(id, answered, Outcome.err(msg, ErrorKind.HOST_FAILURE));
            }
        };

        try {
            transport.forward(call, handler);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "transport rejected call id=" + id, e);
            handler.onFailure(e);
        }
    }

    private void respond(long id, AtomicBoolean answered, Outcome outcome) {
        if (!answered.compareAndSet(false, true)) {
            log.warning(() -> "ignoring duplicate host reply for id=" + id);
            return;
        }
        channel.postMessage(EnvelopeCodec.encode(new InboundResponse(id, outcome)));
    }
}
