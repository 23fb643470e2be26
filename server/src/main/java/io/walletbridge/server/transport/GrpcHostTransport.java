package io.walletbridge.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.stub.StreamObserver;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.core.relay.HostTransport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * gRPC-based HostTransport used by a relay to reach a remote privileged host.
 *
 * Calls are asynchronous: the relay's reply handler is invoked from the gRPC
 * callback thread. Every call carries a deadline so an unresponsive host still
 * produces exactly one (failure) callback. The page's own deadline travels in
 * the request so the host can bound work the page will not wait for.
 */
public final class GrpcHostTransport implements HostTransport, AutoCloseable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final HostBridgeGrpc.HostBridgeStub stub;
    private final Duration deadline;

    /**
     * Production constructor using host and port.
     */
    public GrpcHostTransport(String host, int port, Duration deadline) {
        this(host + ":" + port,
                ManagedChannelBuilder
                        .forAddress(host, port)
                        .usePlaintext() // loopback traffic between relay and host
                        .build(),
                deadline);
    }

    /**
     * Test-only constructor allowing a pre-built channel (e.g., in-process).
     */
    public GrpcHostTransport(String target, ManagedChannel channel, Duration deadline) {
        this.target = Objects.requireNonNull(target, "target");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.deadline = Objects.requireNonNull(deadline, "deadline");
        this.stub = HostBridgeGrpc.newStub(channel);
    }

    @Override
    public void forward(ForwardedCall call, ReplyHandler handler) {
        HostBridgeProto.ForwardedCallRequest req;
        try {
            ArrayNode params = MAPPER.createArrayNode();
            call.params().forEach(params::add);
            req = HostBridgeProto.ForwardedCallRequest.newBuilder()
                    .setType(call.type())
                    .setCorrelationId(call.correlationId())
                    .setOrigin(call.origin())
                    .setParamsJson(MAPPER.writeValueAsString(params))
                    .setDeadlineMillis(call.deadline() == null ? 0L : call.deadline().toEpochMilli())
                    .build();
        } catch (JsonProcessingException e) {
            handler.onFailure(e);
            return;
        }

        stub.withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS)
                .forward(req, new StreamObserver<>() {
                    @Override
                    public void onNext(HostBridgeProto.HostReply reply) {
                        try {
                            handler.onReply(MAPPER.readTree(reply.getReplyJson()));
                        } catch (JsonProcessingException e) {
                            handler.onFailure(e);
                        }
                    }

                    @Override
                    public void onError(Throwable t) {
                        handler.onFailure(new RuntimeException(
                                "gRPC forward to host " + target + " failed: " + t.getMessage(), t));
                    }

                    @Override
                    public void onCompleted() {
                        // unary: onNext already delivered the reply
                    }
                });
    }

    /**
     * Allow graceful shutdown for tests or relay stop.
     */
    @Override
    public void close() {
        channel.shutdown();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
