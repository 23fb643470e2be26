package io.walletbridge.server.transport;

import io.walletbridge.core.relay.ForwardedCall;
import io.walletbridge.core.relay.HostTransport;
import io.walletbridge.server.PrivilegedHost;

import java.util.Objects;

/**
 * HostTransport that calls a {@link PrivilegedHost} in the same process
 * (no network).
 * <br>
 * Used when:
 *  - relay and host share a JVM (embedded setups),
 *  - or in tests where you don't want to spin up gRPC servers.
 */
public final class LocalHostTransport implements HostTransport {

    private final PrivilegedHost host;

    public LocalHostTransport(PrivilegedHost host) {
        this.host = Objects.requireNonNull(host, "host");
    }

    @Override
    public void forward(ForwardedCall call, ReplyHandler handler) {
        host.dispatch(call).whenComplete((reply, err) -> {
            if (err != null) {
                handler.onFailure(err);
            } else {
                handler.onReply(reply);
            }
        });
    }
}
