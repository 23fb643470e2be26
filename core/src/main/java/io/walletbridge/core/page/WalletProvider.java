package io.walletbridge.core.page;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.channel.MessageEvent;
import io.walletbridge.core.channel.WindowChannel;
import io.walletbridge.core.envelope.EnvelopeCodec;
import io.walletbridge.core.envelope.InboundResponse;
import io.walletbridge.core.envelope.OutboundRequest;
import io.walletbridge.core.envelope.Outcome;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Page-side client proxy: the capability API handed to untrusted page code.
 *
 * Responsibilities:
 *  - Allocate correlation ids and own the {@link CorrelationTable}.
 *  - Post outbound envelopes on the shared {@link WindowChannel}.
 *  - Match inbound envelopes back to pending entries by id only; arrival order
 *    is irrelevant.
 *  - Expire entries whose deadline passes first.
 *
 * Threading:
 *  - {@link #request} runs on the caller's thread and never blocks.
 *  - Channel deliveries and deadline timers run on a private {@link EventLoop}.
 *  - The response path and the timeout path settle an entry through the same
 *    atomic remove, so whichever acts first wins and the other is a no-op.
 */
public final class WalletProvider implements AutoCloseable {
    private static final Logger log = Logger.getLogger(WalletProvider.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String ACCOUNTS_CHANGED = "accountsChanged";

    private final WindowChannel channel;
    private final Duration timeout;
    private final Clock clock;
    private final EventLoop loop;
    private final CorrelationTable table = new CorrelationTable();
    private final AtomicLong nextId = new AtomicLong();
    private final ProviderEvents events = new ProviderEvents();
    private final Consumer<MessageEvent> listener;

    private volatile String selectedAddress;
    private volatile boolean connected;

    public WalletProvider(WindowChannel channel) {
        this(channel, DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public WalletProvider(WindowChannel channel, Duration timeout, Clock clock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
        this.loop = new EventLoop("wallet-provider");
        this.listener = event -> loop.execute(() -> onMessage(event));
        channel.subscribe(listener);
    }

    // ---------- core request path ----------

    public CompletableFuture<JsonNode> request(String method) {
        return request(method, List.of());
    }

    /**
     * Issue a capability call.
     *
     * Steps:
     *  1) Take the next correlation id.
     *  2) Register a pending entry, then arm its deadline timer.
     *  3) Post the outbound envelope, stamped with the instant this entry
     *     expires so the host can abandon work nobody waits for.
     *
     * The returned future completes with the host's reply object, or fails
     * with a {@link BridgeException} (host error or {@link ErrorKind#TIMEOUT}).
     */
    public CompletableFuture<JsonNode> request(String method, List<JsonNode> params) {
        Objects.requireNonNull(method, "method");
        if (loop.isShutdown()) {
            return CompletableFuture.failedFuture(BridgeException.timeout("Provider closed"));
        }
        long id = nextId.incrementAndGet();
        var req = new OutboundRequest(id, method, params, clock.instant().plus(timeout));

        PendingEntry entry = new PendingEntry(id, method, clock.instant());
        table.register(id, entry);
        try {
            entry.attachTimer(loop.schedule(() -> expire(id), timeout));
        } catch (RejectedExecutionException closing) {
            // close() raced with this call
            table.reject(id, BridgeException.timeout("Provider closed"));
            return entry.future();
        }

        channel.postMessage(EnvelopeCodec.encode(req));
        return entry.future();
    }

    private void expire(long id) {
        if (table.reject(id, BridgeException.timeout("Request timeout"))) {
            log.info(() -> "request " + id + " timed out after " + timeout.toMillis() + "ms");
        }
    }

    private void onMessage(MessageEvent event) {
        Optional<InboundResponse> decoded = EnvelopeCodec.decodeInbound(event.data());
        if (decoded.isEmpty()) {
            return;
        }
        InboundResponse resp = decoded.get();
        Outcome outcome = resp.outcome();
        boolean settled = outcome.isOk()
                ? table.resolve(resp.id(), outcome.value())
                : table.reject(resp.id(), outcome.toException());
        if (!settled) {
            log.fine(() -> "discarding response for unknown or settled id " + resp.id());
        }
    }

    // ---------- capability wrappers ----------

    /** Look up the wallet address, cache it and mark the provider connected. */
    public CompletableFuture<List<String>> enable() {
        return request(CapabilityMethods.GET_WALLET_ADDRESS).thenApply(result -> {
            JsonNode address = result.get("address");
            if (address == null || !address.isTextual()) {
                throw new BridgeException(ErrorKind.HOST_FAILURE, "host reply has no address");
            }
            String previous = selectedAddress;
            selectedAddress = address.asText();
            connected = true;
            if (!selectedAddress.equals(previous)) {
                events.emit(ACCOUNTS_CHANGED, List.of(selectedAddress));
            }
            return List.of(selectedAddress);
        });
    }

    public CompletableFuture<List<String>> getAccounts() {
        String cached = selectedAddress;
        if (cached != null) {
            return CompletableFuture.completedFuture(List.of(cached));
        }
        return enable();
    }

    /** Balance of {@code address}, or of the selected account when null. */
    public CompletableFuture<JsonNode> getBalance(String address) {
        String target = address != null ? address : selectedAddress;
        JsonNode param = target == null ? NullNode.getInstance() : TextNode.valueOf(target);
        return request(CapabilityMethods.GET_BALANCE, List.of(param));
    }

    public CompletableFuture<JsonNode> sendTransaction(JsonNode tx) {
        Objects.requireNonNull(tx, "tx");
        return request(CapabilityMethods.SIGN_TRANSACTION, List.of(tx));
    }

    public CompletableFuture<String> getChainId() {
        return request(CapabilityMethods.GET_CHAIN_ID).thenApply(r -> r.path("chainId").asText());
    }

    public CompletableFuture<String> getNetworkVersion() {
        return request(CapabilityMethods.GET_NETWORK_VERSION).thenApply(r -> r.path("networkVersion").asText());
    }

    // ---------- events ----------

    public void on(String event, Consumer<Object> callback) {
        events.on(event, callback);
    }

    public void removeListener(String event, Consumer<Object> callback) {
        events.removeListener(event, callback);
    }

    int listenerCount(String event) {
        return events.listenerCount(event);
    }

    // ---------- state ----------

    public boolean isConnected() {
        return connected;
    }

    public String selectedAddress() {
        return selectedAddress;
    }

    /** Number of requests still awaiting a response or deadline. */
    public int pendingCount() {
        return table.size();
    }

    /**
     * Detach from the channel and stop the loop. Requests still pending are
     * rejected so no caller waits forever.
     */
    @Override
    public void close() {
        channel.unsubscribe(listener);
        loop.close();
        int n = table.rejectAll(BridgeException.timeout("Provider closed"));
        if (n > 0) {
            log.log(Level.INFO, "provider closed with {0} pending request(s)", n);
        }
    }
}
