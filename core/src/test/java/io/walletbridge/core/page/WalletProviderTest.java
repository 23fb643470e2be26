package io.walletbridge.core.page;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.channel.WindowChannel;
import io.walletbridge.core.envelope.EnvelopeCodec;
import io.walletbridge.core.envelope.InboundResponse;
import io.walletbridge.core.envelope.OutboundRequest;
import io.walletbridge.core.envelope.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Page-side correlation behaviour of WalletProvider.
 *
 * A capturing listener on the channel plays the relay: it records every
 * outbound envelope, and the test answers them in whatever order it likes.
 */
class WalletProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WindowChannel channel;
    private List<OutboundRequest> sent;
    private WalletProvider provider;

    @BeforeEach
    void setUp() {
        channel = new WindowChannel("https://dapp.example");
        sent = new CopyOnWriteArrayList<>();
        channel.subscribe(e -> EnvelopeCodec.decodeOutbound(e.data()).ifPresent(sent::add));
        provider = new WalletProvider(channel, Duration.ofSeconds(5), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        provider.close();
    }

    private void reply(long id, String json) throws Exception {
        channel.postMessage(EnvelopeCodec.encode(new InboundResponse(id, EnvelopeCodec.toOutcome(MAPPER.readTree(json)))));
    }

    private static <T> T get(CompletableFuture<T> f) throws Exception {
        return f.get(2, TimeUnit.SECONDS);
    }

    private static BridgeException failure(CompletableFuture<?> f) {
        var ex = assertThrows(ExecutionException.class, () -> f.get(2, TimeUnit.SECONDS));
        Throwable cause = ex.getCause();
        while (!(cause instanceof BridgeException) && cause != null && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return assertInstanceOf(BridgeException.class, cause);
    }

    @Test
    void get_balance_resolves_with_host_reply() throws Exception {
        CompletableFuture<JsonNode> f = provider.getBalance("0xabc");

        assertEquals(1, sent.size());
        OutboundRequest req = sent.get(0);
        assertEquals(CapabilityMethods.GET_BALANCE, req.method());
        assertEquals("0xabc", req.params().get(0).asText());

        reply(req.id(), "{\"balance\":\"100\"}");

        assertEquals(MAPPER.readTree("{\"balance\":\"100\"}"), get(f));
        assertEquals(0, provider.pendingCount());
    }

    @Test
    void concurrent_requests_each_settle_with_their_own_reply_regardless_of_order() throws Exception {
        int n = 50;
        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            futures.add(provider.request("ECHO", List.of(MAPPER.valueToTree(i))));
        }
        assertEquals(n, provider.pendingCount());

        List<OutboundRequest> shuffled = new ArrayList<>(sent);
        Collections.reverse(shuffled);
        for (OutboundRequest r : shuffled) {
            ObjectNode body = MAPPER.createObjectNode();
            body.put("echo", r.params().get(0).asInt());
            body.put("id", r.id());
            reply(r.id(), body.toString());
        }

        for (int i = 0; i < n; i++) {
            JsonNode result = get(futures.get(i));
            assertEquals(i, result.get("echo").asInt(), "future " + i + " got someone else's reply");
        }
        assertEquals(0, provider.pendingCount());
    }

    @Test
    void correlation_ids_strictly_increase_and_never_repeat_under_bursts() throws Exception {
        int threads = 8;
        int perThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Long> issuedOrder = new CopyOnWriteArrayList<>();
        channel.subscribe(e -> EnvelopeCodec.decodeOutbound(e.data()).ifPresent(r -> issuedOrder.add(r.id())));

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < perThread; i++) {
                    provider.request("PING");
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        List<Long> ids = new ArrayList<>(issuedOrder);
        assertEquals(threads * perThread, ids.size());
        assertEquals(ids.size(), ids.stream().distinct().count(), "ids must be unique");
        List<Long> sorted = new ArrayList<>(ids);
        Collections.sort(sorted);
        assertEquals(1L, sorted.get(0));
        assertEquals((long) threads * perThread, sorted.get(sorted.size() - 1));

        // single caller: strictly increasing in issue order
        long last = sorted.get(sorted.size() - 1);
        provider.request("PING");
        provider.request("PING");
        OutboundRequest a = sent.get(sent.size() - 2);
        OutboundRequest b = sent.get(sent.size() - 1);
        assertTrue(a.id() > last && b.id() > a.id());
    }

    @Test
    void malformed_or_unrelated_traffic_touches_no_pending_entry() throws Exception {
        CompletableFuture<JsonNode> f = provider.request("PING");
        long id = sent.get(0).id();

        channel.postMessage(MAPPER.readTree("{\"tag\":\"other-extension\",\"id\":" + id + ",\"result\":{\"x\":1}}"));
        channel.postMessage(MAPPER.readTree("{\"tag\":\"provider-response\",\"result\":{\"x\":2}}"));
        channel.postMessage(MAPPER.readTree("\"hello\""));
        channel.deliverFrom(new Object(), "https://evil.example", MAPPER.readTree("[1,2,3]"));

        assertEquals(1, provider.pendingCount());
        assertFalse(f.isDone());

        // the loop is FIFO: once this settles, the junk above was already processed
        reply(id, "{\"x\":3}");
        assertEquals(3, get(f).get("x").asInt());
    }

    @Test
    void unanswered_request_times_out_and_leaves_no_entry() throws Exception {
        provider.close();
        provider = new WalletProvider(channel, Duration.ofMillis(100), Clock.systemUTC());

        ObjectNode tx = MAPPER.createObjectNode().put("to", "0xdef").put("amount", "5");
        CompletableFuture<JsonNode> f = provider.sendTransaction(tx);
        assertEquals(1, provider.pendingCount());

        BridgeException e = failure(f);
        assertEquals(ErrorKind.TIMEOUT, e.kind());
        assertEquals("Request timeout", e.getMessage());
        assertEquals(0, provider.pendingCount());
    }

    @Test
    void posted_transaction_is_detached_from_the_callers_object() {
        channel.subscribe(e -> {
            JsonNode tx = e.data() == null ? null : e.data().path("params").path(0);
            if (tx instanceof ObjectNode o) {
                o.put("to", "0xattacker");
            }
        });
        ObjectNode tx = MAPPER.createObjectNode().put("to", "0xfriend").put("amount", "5");

        provider.sendTransaction(tx);

        assertEquals("0xfriend", tx.get("to").asText());
        assertEquals("0xfriend", sent.get(0).params().get(0).get("to").asText());
    }

    @Test
    void outbound_envelope_carries_the_entry_deadline() {
        Instant before = Instant.now();

        provider.request("GET_CHAIN_ID");

        Instant deadline = sent.get(0).deadline();
        assertNotNull(deadline);
        assertFalse(deadline.isBefore(before.plusSeconds(5).minusMillis(1)));
        assertFalse(deadline.isAfter(Instant.now().plusSeconds(5)));
    }

    @Test
    void late_reply_after_timeout_is_discarded() throws Exception {
        provider.close();
        provider = new WalletProvider(channel, Duration.ofMillis(50), Clock.systemUTC());

        CompletableFuture<JsonNode> f = provider.request("SLOW");
        long id = sent.get(sent.size() - 1).id();
        assertEquals(ErrorKind.TIMEOUT, failure(f).kind());

        reply(id, "{\"late\":true}");
        // drain the loop with a request that does get answered
        CompletableFuture<JsonNode> probe = provider.request("PROBE");
        reply(sent.get(sent.size() - 1).id(), "{\"ok\":true}");
        get(probe);

        assertTrue(f.isCompletedExceptionally(), "still the timeout, never resolved twice");
        assertEquals(0, provider.pendingCount());
    }

    @Test
    void enable_and_chain_id_match_their_own_ids_when_answered_out_of_order() throws Exception {
        CompletableFuture<List<String>> enable = provider.enable();
        CompletableFuture<String> chainId = provider.getChainId();

        OutboundRequest first = sent.get(0);
        OutboundRequest second = sent.get(1);
        assertEquals(CapabilityMethods.GET_WALLET_ADDRESS, first.method());
        assertEquals(CapabilityMethods.GET_CHAIN_ID, second.method());

        reply(second.id(), "{\"chainId\":\"0x1d69\"}");
        reply(first.id(), "{\"address\":\"0x1234\"}");

        assertEquals("0x1d69", get(chainId));
        assertEquals(List.of("0x1234"), get(enable));
        assertTrue(provider.isConnected());
        assertEquals("0x1234", provider.selectedAddress());
    }

    @Test
    void enable_rejects_with_host_error_message() throws Exception {
        CompletableFuture<List<String>> enable = provider.enable();
        reply(sent.get(0).id(), "{\"error\":\"No wallet found\",\"code\":\"NO_WALLET\"}");

        BridgeException e = failure(enable);
        assertEquals("No wallet found", e.getMessage());
        assertEquals(ErrorKind.NO_WALLET, e.kind());
        assertFalse(provider.isConnected());
    }

    @Test
    void get_accounts_uses_cache_after_enable() throws Exception {
        CompletableFuture<List<String>> accounts = provider.getAccounts();
        assertEquals(1, sent.size(), "no cached address: enable() is called");
        reply(sent.get(0).id(), "{\"address\":\"0xaaa\"}");
        assertEquals(List.of("0xaaa"), get(accounts));

        assertEquals(List.of("0xaaa"), get(provider.getAccounts()));
        assertEquals(1, sent.size(), "second call served from cache");
    }

    @Test
    void get_balance_without_address_uses_selected_account() throws Exception {
        CompletableFuture<List<String>> enable = provider.enable();
        reply(sent.get(0).id(), "{\"address\":\"0xbbb\"}");
        get(enable);

        provider.getBalance(null);
        assertEquals("0xbbb", sent.get(1).params().get(0).asText());
    }

    @Test
    void accounts_changed_listeners_fire_until_removed() throws Exception {
        List<Object> seen = new CopyOnWriteArrayList<>();
        java.util.function.Consumer<Object> listener = seen::add;
        provider.on(WalletProvider.ACCOUNTS_CHANGED, listener);

        CompletableFuture<List<String>> enable = provider.enable();
        reply(sent.get(0).id(), "{\"address\":\"0xccc\"}");
        get(enable);
        assertEquals(List.of(List.of("0xccc")), seen);

        provider.removeListener(WalletProvider.ACCOUNTS_CHANGED, listener);
        assertEquals(0, provider.listenerCount(WalletProvider.ACCOUNTS_CHANGED));

        CompletableFuture<List<String>> again = provider.enable();
        reply(sent.get(1).id(), "{\"address\":\"0xddd\"}");
        get(again);
        assertEquals(1, seen.size());
    }

    @Test
    void close_rejects_pending_requests() {
        CompletableFuture<JsonNode> f = provider.request("PING");
        provider.close();

        assertEquals(ErrorKind.TIMEOUT, failure(f).kind());
        assertEquals(0, provider.pendingCount());
        assertTrue(provider.request("AFTER_CLOSE").isCompletedExceptionally());
    }

    @Test
    void err_outcome_from_codec_round_trips_to_caller() throws Exception {
        CompletableFuture<JsonNode> f = provider.request("X");
        channel.postMessage(EnvelopeCodec.encode(
                new InboundResponse(sent.get(0).id(), Outcome.err("User rejected the request", ErrorKind.USER_REJECTED))));
        assertEquals(ErrorKind.USER_REJECTED, failure(f).kind());
    }
}
