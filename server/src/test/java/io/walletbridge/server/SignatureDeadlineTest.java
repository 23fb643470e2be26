package io.walletbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.channel.WindowChannel;
import io.walletbridge.core.page.WalletProvider;
import io.walletbridge.core.relay.Relay;
import io.walletbridge.server.confirm.ConfirmationQueue;
import io.walletbridge.server.transport.LocalHostTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A page that gave up on a signature must never see it signed or broadcast
 * afterwards, even when the host would wait much longer for the user.
 */
class SignatureDeadlineTest {

    private InMemoryKeyStore keyStore;
    private FakeRpcClient rpc;
    private ConfirmationQueue confirmations;
    private Relay relay;
    private WalletProvider provider;

    @BeforeEach
    void setUp() {
        keyStore = InMemoryKeyStore.withWallet();
        rpc = new FakeRpcClient();
        confirmations = new ConfirmationQueue(Duration.ofSeconds(30));
        var cfg = new HostConfig(50051, 8080, "./data/wallet.json", "local", null,
                "0x1d69", "7529", 30, true);
        PrivilegedHost host = Main.buildHost(cfg, keyStore, rpc, confirmations);

        var channel = new WindowChannel("https://dapp.example");
        relay = new Relay(channel, new LocalHostTransport(host));
        relay.start();
        provider = new WalletProvider(channel, Duration.ofMillis(200), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        provider.close();
        relay.close();
        confirmations.close();
    }

    @Test
    void approval_after_the_page_timed_out_is_refused_and_nothing_is_broadcast() {
        ObjectNode tx = JsonNodeFactory.instance.objectNode().put("to", "0xfriend").put("amount", "5");

        CompletableFuture<JsonNode> sent = provider.sendTransaction(tx);
        assertEquals(1, confirmations.pending().size());
        String ticket = confirmations.pending().get(0).ticketId();

        var ex = assertThrows(ExecutionException.class, () -> sent.get(2, TimeUnit.SECONDS));
        assertEquals(ErrorKind.TIMEOUT, assertInstanceOf(BridgeException.class, ex.getCause()).kind());

        assertFalse(confirmations.approve(ticket), "the user can no longer approve");
        assertTrue(confirmations.pending().isEmpty());
        assertTrue(rpc.broadcasts.isEmpty());
    }

    @Test
    void approval_inside_the_page_deadline_still_signs_and_broadcasts() throws Exception {
        ObjectNode tx = JsonNodeFactory.instance.objectNode().put("to", "0xfriend").put("amount", "5");

        CompletableFuture<JsonNode> sent = provider.sendTransaction(tx);
        assertTrue(confirmations.approve(confirmations.pending().get(0).ticketId()));

        JsonNode signed = sent.get(2, TimeUnit.SECONDS);
        assertEquals("0xhash1", signed.get("hash").asText());
        assertEquals(1, rpc.broadcasts.size());
    }
}
