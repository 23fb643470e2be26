package io.walletbridge.core.relay;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The privileged host's own messaging primitive, as seen by the relay.
 *
 * Implementations:
 *  - in-process: call the host directly;
 *  - remote: send the call over gRPC.
 *
 * An implementation must invoke exactly one of the two callbacks, once; the
 * relay still guards against a transport that does not.
 */
public interface HostTransport {

    void forward(ForwardedCall call, ReplyHandler handler);

    interface ReplyHandler {
        /** Host reply object: success fields, or {@code {error, code}}. */
        void onReply(JsonNode reply);

        /** The call never reached the host, or the reply never came back. */
        void onFailure(Throwable error);
    }
}
