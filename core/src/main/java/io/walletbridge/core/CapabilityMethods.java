package io.walletbridge.core;

/**
 * Method names understood by the privileged host.
 */
public final class CapabilityMethods {

    public static final String GET_WALLET_ADDRESS = "GET_WALLET_ADDRESS";
    public static final String GET_BALANCE = "GET_BALANCE";
    public static final String SIGN_TRANSACTION = "SIGN_TRANSACTION";
    public static final String GET_CHAIN_ID = "GET_CHAIN_ID";
    public static final String GET_NETWORK_VERSION = "GET_NETWORK_VERSION";

    private CapabilityMethods() {
        // constants
    }
}
