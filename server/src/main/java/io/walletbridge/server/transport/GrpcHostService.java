package io.walletbridge.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.server.PrivilegedHost;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * gRPC service that exposes the {@link PrivilegedHost} to relays.
 *
 * Responsibilities:
 *  - Decode ForwardedCallRequest into a {@link ForwardedCall}.
 *  - Answer with the host's reply object as JSON once dispatch completes.
 *  - Map undecodable params to INVALID_ARGUMENT; anything unexpected to INTERNAL.
 *  - Carry the page deadline into the call, or the gRPC deadline when that
 *    comes first.
 *  - Cancel the dispatch when the client cancels or the gRPC deadline passes.
 *
 * Capability errors are not gRPC errors: they travel inside reply_json.
 */
public final class GrpcHostService extends HostBridgeGrpc.HostBridgeImplBase {
    private static final Logger log = Logger.getLogger(GrpcHostService.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PrivilegedHost host;

    public GrpcHostService(PrivilegedHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public void forward(
            HostBridgeProto.ForwardedCallRequest request,
            StreamObserver<HostBridgeProto.HostReply> responseObserver
    ) {
        ForwardedCall call;
        try {
            call = new ForwardedCall(
                    request.getType(),
                    request.getCorrelationId(),
                    request.getOrigin(),
                    parseParams(request.getParamsJson()),
                    deadlineOf(request, Context.current())
            );
        } catch (IllegalArgumentException | JsonProcessingException bad) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(bad.getMessage())
                            .asException()
            );
            return;
        }

        CompletableFuture<ObjectNode> dispatched = host.dispatch(call);
        ServerCallStreamObserver<HostBridgeProto.HostReply> serverObserver =
                responseObserver instanceof ServerCallStreamObserver<HostBridgeProto.HostReply> sco ? sco : null;
        if (serverObserver != null) {
            long id = call.correlationId();
            serverObserver.setOnCancelHandler(() -> {
                if (dispatched.cancel(false)) {
                    log.info(() -> "relay stopped waiting for id=" + id + ", dispatch cancelled");
                }
            });
        }

        dispatched.whenComplete((reply, err) -> {
            if (dispatched.isCancelled() || (serverObserver != null && serverObserver.isCancelled())) {
                return;
            }
            if (err != null) {
                responseObserver.onError(
                        Status.INTERNAL
                                .withDescription(err.getMessage())
                                .asException()
                );
                return;
            }
            try {
                responseObserver.onNext(
                        HostBridgeProto.HostReply.newBuilder()
                                .setReplyJson(MAPPER.writeValueAsString(reply))
                                .build()
                );
                responseObserver.onCompleted();
            } catch (JsonProcessingException e) {
                responseObserver.onError(
                        Status.INTERNAL
                                .withDescription("cannot encode reply: " + e.getMessage())
                                .asException()
                );
            }
        });
    }

    private static Instant deadlineOf(HostBridgeProto.ForwardedCallRequest request, Context context) {
        Instant page = request.getDeadlineMillis() > 0 ? Instant.ofEpochMilli(request.getDeadlineMillis()) : null;
        Deadline grpc = context.getDeadline();
        if (grpc == null) {
            return page;
        }
        Instant transport = Instant.now().plusNanos(grpc.timeRemaining(TimeUnit.NANOSECONDS));
        return page == null || transport.isBefore(page) ? transport : page;
    }

    private static List<JsonNode> parseParams(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode node = MAPPER.readTree(json);
        if (!node.isArray()) {
            throw new IllegalArgumentException("params_json must be a JSON array");
        }
        List<JsonNode> params = new ArrayList<>(node.size());
        node.forEach(params::add);
        return params;
    }
}
