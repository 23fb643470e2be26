package io.walletbridge.server.rpc;

import java.net.URI;
import java.util.Locale;

/**
 * Named networks with well-known RPC endpoints.
 */
public enum RpcNetwork {
    LOCAL("http://localhost:8545"),
    TESTNET("https://testnet-rpc.spirachain.org"),
    MAINNET("https://rpc.spirachain.org");

    private final URI endpoint;

    RpcNetwork(String endpoint) {
        this.endpoint = URI.create(endpoint);
    }

    public URI endpoint() {
        return endpoint;
    }

    public static RpcNetwork fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "local" -> LOCAL;
            case "testnet" -> TESTNET;
            case "mainnet" -> MAINNET;
            default -> throw new IllegalArgumentException(
                    "network must be one of: local, testnet, mainnet (got " + name + ")");
        };
    }
}
