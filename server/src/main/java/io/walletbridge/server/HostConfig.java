package io.walletbridge.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.walletbridge.server.dto.HostConfigFile;
import io.walletbridge.server.rpc.RpcNetwork;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/**
 * Privileged host configuration.
 *
 * Supports:
 *  - grpcPort:              port relays forward calls to
 *  - httpPort:              confirmation / admin HTTP port (loopback only)
 *  - walletPath:            JSON wallet file read by the key store
 *  - network:               named RPC network (local, testnet, mainnet)
 *  - rpcUrl:                custom RPC endpoint; overrides network when set
 *  - chainId:               value answered for GET_CHAIN_ID
 *  - networkVersion:        value answered for GET_NETWORK_VERSION
 *  - confirmTimeoutSeconds: how long a signature waits for a user decision
 *  - broadcast:             submit signed transactions through RPC
 */
public record HostConfig(
        int grpcPort,
        int httpPort,
        String walletPath,
        String network,
        String rpcUrl,
        String chainId,
        String networkVersion,
        long confirmTimeoutSeconds,
        boolean broadcast
) {

    public HostConfig {
        if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
        if (confirmTimeoutSeconds <= 0) throw new IllegalArgumentException("confirmTimeoutSeconds must be > 0");
        RpcNetwork.fromName(network);
    }

    public static HostConfig defaults() {
        return new HostConfig(50051, 8080, "./data/wallet.json", "local", null,
                "0x1d69", "7529", 30, false);
    }

    /** RPC endpoint: the custom URL when set, else the named network's. */
    public URI rpcEndpoint() {
        return (rpcUrl != null && !rpcUrl.isBlank())
                ? URI.create(rpcUrl)
                : RpcNetwork.fromName(network).endpoint();
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --config,     -c   <path>   JSON config file (applied first)
     *   --grpc-port,  -g   <port>
     *   --http-port,  -p   <port>
     *   --wallet,     -w   <path>
     *   --network,    -n   <local|testnet|mainnet>
     *   --rpc-url          <url>
     *   --chain-id         <hex>
     *   --network-version  <n>
     *   --confirm-timeout-seconds <seconds>
     *   --broadcast
     *
     * Bad values raise IllegalArgumentException; --help is handled by Main.
     */
    public static HostConfig fromArgs(String[] args) {
        HostConfig base = defaults();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                base = base.withFile(Path.of(value(args, i)));
            }
        }

        int grpcPort = base.grpcPort;
        int httpPort = base.httpPort;
        String wallet = base.walletPath;
        String network = base.network;
        String rpcUrl = base.rpcUrl;
        String chainId = base.chainId;
        String networkVersion = base.networkVersion;
        long confirmTimeout = base.confirmTimeoutSeconds;
        boolean broadcast = base.broadcast;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;
                case "--grpc-port", "-g" -> grpcPort = parseInt(args[i], value(args, i++));
                case "--http-port", "-p" -> httpPort = parseInt(args[i], value(args, i++));
                case "--wallet", "-w" -> wallet = value(args, i++);
                case "--network", "-n" -> network = value(args, i++);
                case "--rpc-url" -> rpcUrl = value(args, i++);
                case "--chain-id" -> chainId = value(args, i++);
                case "--network-version" -> networkVersion = value(args, i++);
                case "--confirm-timeout-seconds" -> confirmTimeout = parseInt(args[i], value(args, i++));
                case "--broadcast" -> broadcast = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        return new HostConfig(grpcPort, httpPort, wallet, network, rpcUrl, chainId,
                networkVersion, confirmTimeout, broadcast);
    }

    /** Overlay the non-null fields of a JSON config file. */
    HostConfig withFile(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        HostConfigFile f;
        try {
            f = mapper.readValue(path.toFile(), HostConfigFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load host config from " + path, e);
        }
        return new HostConfig(
                f.grpcPort != null ? f.grpcPort : grpcPort,
                f.httpPort != null ? f.httpPort : httpPort,
                f.walletPath != null ? f.walletPath : walletPath,
                f.network != null ? f.network : network,
                f.rpcUrl != null ? f.rpcUrl : rpcUrl,
                f.chainId != null ? f.chainId : chainId,
                f.networkVersion != null ? f.networkVersion : networkVersion,
                f.confirmTimeoutSeconds != null ? f.confirmTimeoutSeconds : confirmTimeoutSeconds,
                f.broadcast != null ? f.broadcast : broadcast
        );
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String option, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + option + ": " + raw, e);
        }
    }

    static String usage() {
        return """
            Usage: walletbridge-host [options]

            Options:
              --config,        -c   JSON config file (flags override it)
              --grpc-port,     -g   gRPC port for relays (default: 50051)
              --http-port,     -p   Confirmation/admin HTTP port (default: 8080)
              --wallet,        -w   Wallet JSON file (default: ./data/wallet.json)
              --network,       -n   local | testnet | mainnet (default: local)
              --rpc-url             Custom RPC endpoint (overrides --network)
              --chain-id            Chain id reported to pages (default: 0x1d69)
              --network-version     Network version reported to pages (default: 7529)
              --confirm-timeout-seconds
                                    Time a signature waits for a decision (default: 30)
              --broadcast           Submit signed transactions through RPC
              --help,          -h   Show this help message
            """;
    }
}
