package io.walletbridge.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Wallet material as held by a {@link WalletKeyStore}.
 *
 * @param address       public account address ("0x" + 40 hex chars)
 * @param publicKeyHex  hex-encoded public key
 * @param privateKeyHex hex-encoded private key material (store-specific encoding)
 * @param createdAt     epoch millis the wallet was created, 0 if unknown
 */
public record WalletRecord(String address, String publicKeyHex, String privateKeyHex, long createdAt) {

    public WalletRecord {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(publicKeyHex, "publicKeyHex");
        Objects.requireNonNull(privateKeyHex, "privateKeyHex");
        if (address.isBlank()) throw new IllegalArgumentException("address must not be blank");
    }

    /** Address convention: "0x" + first 40 hex chars of SHA-256(publicKey). */
    public static String addressOf(byte[] publicKey) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(publicKey);
            return "0x" + HexFormat.of().formatHex(hash).substring(0, 40);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        // keep private material out of logs
        return "WalletRecord[address=" + address + ", publicKeyHex=" + publicKeyHex
                + ", createdAt=" + createdAt + "]";
    }
}
