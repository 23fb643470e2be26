package io.walletbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.CapabilityMethods;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.server.confirm.ConfirmationQueue;
import io.walletbridge.server.confirm.ConfirmationTicket;
import io.walletbridge.server.handler.CapabilityHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PrivilegedHostTest {

    private static final String ORIGIN = "https://dapp.example";

    private InMemoryKeyStore keyStore;
    private FakeRpcClient rpc;
    private ConfirmationQueue confirmations;
    private PrivilegedHost host;

    @BeforeEach
    void setUp() {
        keyStore = InMemoryKeyStore.withWallet();
        rpc = new FakeRpcClient();
        confirmations = new ConfirmationQueue(Duration.ofSeconds(5));
        host = Main.buildHost(HostConfig.defaults(), keyStore, rpc, confirmations);
    }

    @AfterEach
    void tearDown() {
        confirmations.close();
    }

    private static ForwardedCall call(long id, String type, JsonNode... params) {
        return new ForwardedCall(type, id, ORIGIN, List.of(params));
    }

    private ObjectNode dispatch(ForwardedCall call) throws Exception {
        return host.dispatch(call).get(2, TimeUnit.SECONDS);
    }

    @Test
    void registers_every_capability() {
        assertEquals(Set.of(
                CapabilityMethods.GET_WALLET_ADDRESS,
                CapabilityMethods.GET_BALANCE,
                CapabilityMethods.SIGN_TRANSACTION,
                CapabilityMethods.GET_CHAIN_ID,
                CapabilityMethods.GET_NETWORK_VERSION), host.methods());
    }

    @Test
    void answers_address_balance_and_chain_info() throws Exception {
        rpc.balances.put(keyStore.address(), "1000");

        assertEquals(keyStore.address(), dispatch(call(1, CapabilityMethods.GET_WALLET_ADDRESS)).get("address").asText());
        assertEquals("1000", dispatch(call(2, CapabilityMethods.GET_BALANCE, TextNode.valueOf(keyStore.address())))
                .get("balance").asText());
        assertEquals("0x1d69", dispatch(call(3, CapabilityMethods.GET_CHAIN_ID)).get("chainId").asText());
        assertEquals("7529", dispatch(call(4, CapabilityMethods.GET_NETWORK_VERSION)).get("networkVersion").asText());
    }

    @Test
    void unknown_method_replies_with_error() throws Exception {
        ObjectNode reply = dispatch(call(5, "DROP_TABLES"));

        assertEquals("Unknown request type", reply.get("error").asText());
        assertEquals("UNKNOWN_METHOD", reply.get("code").asText());
    }

    @Test
    void missing_wallet_replies_no_wallet() throws Exception {
        host = Main.buildHost(HostConfig.defaults(), InMemoryKeyStore.empty(), rpc, confirmations);

        ObjectNode reply = dispatch(call(6, CapabilityMethods.GET_WALLET_ADDRESS));

        assertEquals("No wallet found", reply.get("error").asText());
        assertEquals("NO_WALLET", reply.get("code").asText());
    }

    @Test
    void balance_without_address_is_invalid_params() throws Exception {
        ObjectNode reply = dispatch(call(7, CapabilityMethods.GET_BALANCE));

        assertEquals("INVALID_PARAMS", reply.get("code").asText());
    }

    @Test
    void network_failure_becomes_network_error_reply() throws Exception {
        rpc.offline = true;

        ObjectNode reply = dispatch(call(8, CapabilityMethods.GET_BALANCE, TextNode.valueOf("0xabc")));

        assertEquals("HTTP error! status: 503", reply.get("error").asText());
        assertEquals("NETWORK_ERROR", reply.get("code").asText());
    }

    @Test
    void handler_faults_sync_or_async_never_drop_the_call() throws Exception {
        host = new PrivilegedHost(List.of(
                handler("SYNC_BOOM", c -> {
                    throw new IllegalStateException("boom");
                }),
                handler("ASYNC_BOOM", c -> CompletableFuture.failedFuture(
                        new CompletionException(BridgeException.userRejected()))),
                handler("NULL_REPLY", c -> CompletableFuture.completedFuture(null))
        ));

        ObjectNode sync = dispatch(call(1, "SYNC_BOOM"));
        assertEquals("boom", sync.get("error").asText());
        assertEquals("HOST_FAILURE", sync.get("code").asText());

        ObjectNode async = dispatch(call(2, "ASYNC_BOOM"));
        assertEquals("User rejected the request", async.get("error").asText());
        assertEquals("USER_REJECTED", async.get("code").asText());

        assertEquals("HOST_FAILURE", dispatch(call(3, "NULL_REPLY")).get("code").asText());
    }

    @Test
    void duplicate_handlers_are_rejected() {
        var a = handler("X", c -> CompletableFuture.completedFuture(JsonNodeFactory.instance.objectNode()));
        var b = handler("X", c -> CompletableFuture.completedFuture(JsonNodeFactory.instance.objectNode()));

        assertThrows(IllegalArgumentException.class, () -> new PrivilegedHost(List.of(a, b)));
    }

    @Test
    void pending_signature_does_not_block_other_calls() throws Exception {
        ObjectNode tx = JsonNodeFactory.instance.objectNode().put("to", "0xdef").put("amount", 25);
        CompletableFuture<ObjectNode> signing = host.dispatch(call(10, CapabilityMethods.SIGN_TRANSACTION, tx));

        assertFalse(signing.isDone());
        assertEquals("0x1d69", dispatch(call(11, CapabilityMethods.GET_CHAIN_ID)).get("chainId").asText());
        assertEquals(keyStore.address(), dispatch(call(12, CapabilityMethods.GET_WALLET_ADDRESS)).get("address").asText());
        assertFalse(signing.isDone());

        List<ConfirmationTicket> pending = confirmations.pending();
        assertEquals(1, pending.size());
        assertEquals(10, pending.get(0).correlationId());
        assertEquals(ORIGIN, pending.get(0).origin());
        assertTrue(confirmations.approve(pending.get(0).ticketId()));

        ObjectNode signed = signing.get(2, TimeUnit.SECONDS);
        assertEquals("0xdef", signed.get("to").asText());
        assertEquals("25", signed.get("amount").asText());
        assertTrue(signed.hasNonNull("signature"));
        assertFalse(signed.has("hash"), "broadcast is off by default");
    }

    @Test
    void rejected_signature_replies_user_rejected() throws Exception {
        ObjectNode tx = JsonNodeFactory.instance.objectNode().put("to", "0xdef").put("amount", "1");
        CompletableFuture<ObjectNode> signing = host.dispatch(call(20, CapabilityMethods.SIGN_TRANSACTION, tx));

        assertTrue(confirmations.reject(confirmations.pending().get(0).ticketId()));

        ObjectNode reply = signing.get(2, TimeUnit.SECONDS);
        assertEquals("User rejected the request", reply.get("error").asText());
        assertEquals("USER_REJECTED", reply.get("code").asText());
    }

    @Test
    void cancelling_a_pending_signature_withdraws_its_ticket() {
        ObjectNode tx = JsonNodeFactory.instance.objectNode().put("to", "0xdef").put("amount", "3");
        CompletableFuture<ObjectNode> signing = host.dispatch(call(30, CapabilityMethods.SIGN_TRANSACTION, tx));
        String ticket = confirmations.pending().get(0).ticketId();

        assertTrue(signing.cancel(false));

        assertTrue(confirmations.pending().isEmpty());
        assertFalse(confirmations.approve(ticket));
        assertTrue(rpc.broadcasts.isEmpty());
    }

    @Test
    void error_reply_for_plain_exception_without_message_uses_type_name() {
        ObjectNode reply = PrivilegedHost.errorReply(new NullPointerException());

        assertEquals("NullPointerException", reply.get("error").asText());
        assertEquals("HOST_FAILURE", reply.get("code").asText());
    }

    private static CapabilityHandler handler(
            String method,
            java.util.function.Function<ForwardedCall, CompletableFuture<ObjectNode>> body
    ) {
        return new CapabilityHandler() {
            @Override
            public String method() {
                return method;
            }

            @Override
            public CompletableFuture<ObjectNode> handle(ForwardedCall call) {
                return body.apply(call);
            }
        };
    }
}
