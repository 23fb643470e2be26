package io.walletbridge.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.walletbridge.server.confirm.ConfirmationQueue;
import io.walletbridge.server.handler.ChainInfoHandler;
import io.walletbridge.server.handler.GetBalanceHandler;
import io.walletbridge.server.handler.GetWalletAddressHandler;
import io.walletbridge.server.handler.RandomNonceSource;
import io.walletbridge.server.handler.SignTransactionHandler;
import io.walletbridge.server.rpc.JsonRpcNetworkClient;
import io.walletbridge.server.rpc.RpcNetworkClient;
import io.walletbridge.server.transport.GrpcHostService;
import io.walletbridge.storage.JsonFileWalletKeyStore;
import io.walletbridge.storage.WalletKeyStore;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the privileged host process.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and optional JSON file).
 *  - Wire the wallet key store, RPC client, confirmation queue and handlers.
 *  - Start the gRPC server relays forward calls to.
 *  - Start the loopback HTTP confirmation surface.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        if (Arrays.asList(args).contains("--help") || Arrays.asList(args).contains("-h")) {
            System.out.println(HostConfig.usage());
            return;
        }

        HostConfig cfg;
        try {
            cfg = HostConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(HostConfig.usage());
            System.exit(1);
            return;
        }

        // ------ Collaborators -------
        WalletKeyStore keyStore = new JsonFileWalletKeyStore(Path.of(cfg.walletPath()));
        RpcNetworkClient rpc = new JsonRpcNetworkClient(cfg.rpcEndpoint(), Duration.ofSeconds(10));
        var confirmations = new ConfirmationQueue(Duration.ofSeconds(cfg.confirmTimeoutSeconds()));

        // ------ Dispatch table -------
        PrivilegedHost host = buildHost(cfg, keyStore, rpc, confirmations);

        // ------ gRPC for relays ------
        Server grpcServer = ServerBuilder
                .forPort(cfg.grpcPort())
                .addService(new GrpcHostService(host))
                .build();

        // ------ HTTP confirmation surface ------
        var web = new ConfirmationWebServer(cfg.httpPort(), confirmations);

        if (!keyStore.hasWallet()) {
            log.warning(() -> "no wallet at " + cfg.walletPath() + "; address and signing calls will fail");
        }

        web.start();
        grpcServer.start();

        log.info(() -> String.format(
                "Host serving %s on grpc://localhost:%d, confirmations on http://127.0.0.1:%d, rpc %s",
                host.methods(), cfg.grpcPort(), cfg.httpPort(), cfg.rpcEndpoint()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                grpcServer.shutdown();
                web.stop();
                confirmations.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }));

        try {
            grpcServer.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static PrivilegedHost buildHost(
            HostConfig cfg,
            WalletKeyStore keyStore,
            RpcNetworkClient rpc,
            ConfirmationQueue confirmations
    ) {
        return new PrivilegedHost(List.of(
                new GetWalletAddressHandler(keyStore),
                new GetBalanceHandler(rpc),
                new SignTransactionHandler(
                        keyStore,
                        confirmations,
                        new RandomNonceSource(),
                        rpc,
                        cfg.broadcast(),
                        Clock.systemUTC()
                ),
                ChainInfoHandler.chainId(cfg.chainId()),
                ChainInfoHandler.networkVersion(cfg.networkVersion())
        ));
    }
}
