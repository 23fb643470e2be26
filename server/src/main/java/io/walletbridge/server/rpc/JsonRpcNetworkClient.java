package io.walletbridge.server.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-RPC 2.0 client over HTTP.
 *
 * Request:
 *   POST {endpoint}
 *   {"jsonrpc":"2.0","id":1,"method":"account_getBalance","params":["0xabc"]}
 *
 * Failure mapping (all NETWORK_ERROR):
 *  - connect / IO errors,
 *  - non-200 status ("HTTP error! status: 503"),
 *  - unparsable body,
 *  - a JSON-RPC "error" member (its message, or "RPC error").
 */
public final class JsonRpcNetworkClient implements RpcNetworkClient {
    private static final Logger log = Logger.getLogger(JsonRpcNetworkClient.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI endpoint;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final AtomicLong ids = new AtomicLong();

    public JsonRpcNetworkClient(URI endpoint, Duration requestTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    public URI endpoint() {
        return endpoint;
    }

    @Override
    public CompletableFuture<String> getBalance(String address) {
        return call("account_getBalance", address)
                .thenApply(result -> result == null || result.isNull() ? "0" : result.asText());
    }

    @Override
    public CompletableFuture<String> sendTransaction(JsonNode signedTx) {
        return call("chain_sendTransaction", signedTx).thenApply(result -> {
            if (result == null || result.isNull() || result.asText().isBlank()) {
                throw new BridgeException(ErrorKind.NETWORK_ERROR, "RPC returned no transaction hash");
            }
            return result.asText();
        });
    }

    /** Perform one JSON-RPC call; completes with the "result" member (possibly null). */
    CompletableFuture<JsonNode> call(String method, Object... params) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", ids.incrementAndGet());
        body.put("method", method);
        ArrayNode arr = body.putArray("params");
        for (Object p : params) {
            arr.add(MAPPER.valueToTree(p));
        }

        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(MAPPER.writeValueAsBytes(body)))
                    .build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new BridgeException(ErrorKind.NETWORK_ERROR, "cannot encode RPC request", e));
        }

        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .handle((resp, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null
                                ? err.getCause() : err;
                        log.log(Level.WARNING, "RPC call " + method + " to " + endpoint + " failed", cause);
                        throw new BridgeException(ErrorKind.NETWORK_ERROR,
                                "RPC call " + method + " failed: " + describe(cause), cause);
                    }
                    return parse(method, resp);
                });
    }

    private static JsonNode parse(String method, HttpResponse<String> resp) {
        if (resp.statusCode() != 200) {
            throw new BridgeException(ErrorKind.NETWORK_ERROR, "HTTP error! status: " + resp.statusCode());
        }
        JsonNode data;
        try {
            data = MAPPER.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new BridgeException(ErrorKind.NETWORK_ERROR, "invalid RPC response for " + method, e);
        }
        if (data == null || !data.isObject()) {
            throw new BridgeException(ErrorKind.NETWORK_ERROR, "invalid RPC response for " + method);
        }
        JsonNode error = data.get("error");
        if (error != null && !error.isNull()) {
            String msg = error.path("message").asText("");
            throw new BridgeException(ErrorKind.NETWORK_ERROR, msg.isBlank() ? "RPC error" : msg);
        }
        return data.get("result");
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
