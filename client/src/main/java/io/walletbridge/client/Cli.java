package io.walletbridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walletbridge.core.BridgeException;
import io.walletbridge.core.ErrorKind;
import io.walletbridge.core.channel.WindowChannel;
import io.walletbridge.core.page.WalletProvider;
import io.walletbridge.core.relay.Relay;
import io.walletbridge.server.transport.GrpcHostTransport;

import java.io.PrintStream;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Command line page context for a running privileged host.
 *
 * Hosts a page channel, a relay and a WalletProvider in-process; the relay
 * forwards to the host over gRPC.
 *
 * Usage:
 *   walletbridge-cli [--host host:port] [--origin url] [--timeout-seconds n] enable
 *   walletbridge-cli ... accounts
 *   walletbridge-cli ... balance [address]
 *   walletbridge-cli ... send <to> <amount> [purpose]
 *   walletbridge-cli ... chain-id
 *   walletbridge-cli ... network-version
 */
public final class Cli {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WalletProvider provider;
    private final PrintStream out;
    private final PrintStream err;

    Cli(WalletProvider provider, PrintStream out, PrintStream err) {
        this.provider = provider;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        CliConfig cfg;
        try {
            cfg = CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            usageAndExit(e.getMessage());
            return;
        }
        if (cfg.command().isEmpty()) {
            usageAndExit("missing command");
            return;
        }

        var channel = new WindowChannel(cfg.origin());
        var transport = new GrpcHostTransport(cfg.host(), cfg.port(), cfg.timeout().plusSeconds(5));
        var relay = new Relay(channel, transport);
        relay.start();

        int code;
        try (var provider = new WalletProvider(channel, cfg.timeout(), Clock.systemUTC())) {
            code = new Cli(provider, System.out, System.err).run(cfg.command());
        } finally {
            relay.close();
            transport.close();
        }
        System.exit(code);
    }

    /**
     * Run one command to completion.
     *
     * @return process exit code: 0 success, 1 bridge error or bad usage
     */
    int run(List<String> command) {
        try {
            Object result = switch (command.get(0)) {
                case "enable" -> await(provider.enable());
                case "accounts" -> await(provider.getAccounts());
                case "balance" -> await(provider.getBalance(command.size() > 1 ? command.get(1) : null));
                case "send" -> {
                    if (command.size() < 3) {
                        throw new IllegalArgumentException("send requires <to> <amount> [purpose]");
                    }
                    ObjectNode tx = MAPPER.createObjectNode();
                    tx.put("to", command.get(1));
                    tx.put("amount", command.get(2));
                    if (command.size() > 3) {
                        tx.put("purpose", command.get(3));
                    }
                    yield await(provider.sendTransaction(tx));
                }
                case "chain-id" -> await(provider.getChainId());
                case "network-version" -> await(provider.getNetworkVersion());
                default -> throw new IllegalArgumentException("unknown command: " + command.get(0));
            };
            out.println(render(result));
            return 0;
        } catch (BridgeException e) {
            err.println("error [" + e.kind() + "]: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException(ErrorKind.TIMEOUT, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof BridgeException be) {
                throw be;
            }
            throw new BridgeException(ErrorKind.HOST_FAILURE,
                    String.valueOf(cause.getMessage()), cause);
        }
    }

    private static String render(Object result) {
        if (result instanceof JsonNode node) {
            try {
                return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                return node.toString();
            }
        }
        if (result instanceof List<?> list) {
            return String.join("\n", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(result);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  walletbridge-cli [--host host:port] [--origin url] [--timeout-seconds n] <command>

                Commands:
                  enable                      connect and print the wallet address
                  accounts                    print the selected account
                  balance [address]           balance of address (default: selected account)
                  send <to> <amount> [purpose]  request a signature (confirm on the host)
                  chain-id                    print the chain id
                  network-version             print the network version
                """);
        System.exit(1);
    }
}
