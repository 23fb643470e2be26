package io.walletbridge.server.dto;

/**
 * JSON shape of the optional host config file (--config). Every field is
 * optional; absent fields keep their defaults and CLI flags win over the file.
 * Example:
 *   {
 *     "grpcPort": 50051,
 *     "httpPort": 8080,
 *     "walletPath": "./data/wallet.json",
 *     "network": "testnet",
 *     "rpcUrl": null,
 *     "chainId": "0x1d69",
 *     "networkVersion": "7529",
 *     "confirmTimeoutSeconds": 30,
 *     "broadcast": false
 *   }
 */
public class HostConfigFile {
    public Integer grpcPort;
    public Integer httpPort;
    public String walletPath;
    public String network;
    public String rpcUrl;
    public String chainId;
    public String networkVersion;
    public Long confirmTimeoutSeconds;
    public Boolean broadcast;
}
