package io.walletbridge.client;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Options of the CLI, parsed from the leading flags; the rest is the command.
 *
 * Supported flags:
 *   --host             host:port of the privileged host's gRPC endpoint (default: localhost:50051)
 *   --origin           origin of the simulated page context (default: http://localhost)
 *   --timeout-seconds  page-side request deadline (default: 30)
 */
public record CliConfig(String host, int port, String origin, Duration timeout, List<String> command) {

    public CliConfig {
        command = List.copyOf(command);
    }

    public static CliConfig fromArgs(String[] args) {
        String host = "localhost";
        int port = 50051;
        String origin = "http://localhost";
        Duration timeout = Duration.ofSeconds(30);

        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException(flag + " requires a value");
            }
            String value = args[i + 1];
            switch (flag) {
                case "--host" -> {
                    int colon = value.lastIndexOf(':');
                    if (colon <= 0 || colon == value.length() - 1) {
                        throw new IllegalArgumentException("--host must be host:port, got " + value);
                    }
                    host = value.substring(0, colon);
                    port = parsePositive(flag, value.substring(colon + 1));
                }
                case "--origin" -> origin = value;
                case "--timeout-seconds" -> timeout = Duration.ofSeconds(parsePositive(flag, value));
                default -> throw new IllegalArgumentException("unknown option: " + flag);
            }
            i += 2;
        }
        return new CliConfig(host, port, origin, timeout, Arrays.asList(args).subList(i, args.length));
    }

    private static int parsePositive(String flag, String raw) {
        try {
            int v = Integer.parseInt(raw);
            if (v <= 0) {
                throw new IllegalArgumentException(flag + " must be > 0");
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + flag + ": " + raw, e);
        }
    }
}
