package io.walletbridge.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * WalletKeyStore backed by a single JSON wallet file.
 * <p>
 * File format (same fields the browser extension stored):
 *   {
 *     "address":    "0x3f5c...",
 *     "publicKey":  "302a3005...",
 *     "privateKey": "302e0201...",
 *     "createdAt":  1718000000000
 *   }
 * <p>
 * Keys are Ed25519: {@code publicKey} is the X.509 encoding and
 * {@code privateKey} the PKCS#8 encoding, both hex. A missing file means no
 * wallet. When {@code address} is absent it is derived from the public key.
 * The file is re-read on every load so an external wallet manager can replace it.
 */
public final class JsonFileWalletKeyStore implements WalletKeyStore {
    private static final Logger log = Logger.getLogger(JsonFileWalletKeyStore.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final HexFormat HEX = HexFormat.of();

    private final Path walletFile;

    public JsonFileWalletKeyStore(Path walletFile) {
        this.walletFile = Objects.requireNonNull(walletFile, "walletFile");
    }

    @Override
    public boolean hasWallet() {
        return Files.isRegularFile(walletFile);
    }

    @Override
    public Optional<WalletRecord> loadWallet() {
        if (!hasWallet()) {
            return Optional.empty();
        }
        try {
            WalletFile f = MAPPER.readValue(walletFile.toFile(), WalletFile.class);
            if (f.publicKey == null || f.privateKey == null) {
                throw new IllegalStateException("wallet file " + walletFile + " lacks key material");
            }
            String address = (f.address == null || f.address.isBlank())
                    ? WalletRecord.addressOf(HEX.parseHex(strip0x(f.publicKey)))
                    : f.address;
            return Optional.of(new WalletRecord(address, f.publicKey, f.privateKey, f.createdAt));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read wallet file " + walletFile, e);
        }
    }

    @Override
    public byte[] sign(byte[] digest, WalletRecord wallet) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(wallet, "wallet");
        try {
            byte[] pkcs8 = HEX.parseHex(strip0x(wallet.privateKeyHex()));
            PrivateKey key = KeyFactory.getInstance("Ed25519").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
            Signature sig = Signature.getInstance("Ed25519");
            sig.initSign(key);
            sig.update(digest);
            byte[] out = sig.sign();
            log.fine(() -> "signed " + digest.length + "-byte digest for " + wallet.address());
            return out;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to sign with wallet " + wallet.address(), e);
        }
    }

    private static String strip0x(String hex) {
        return hex.startsWith("0x") ? hex.substring(2) : hex;
    }

    /** JSON shape of the wallet file. */
    public static class WalletFile {
        public String address;
        public String publicKey;
        public String privateKey;
        public long createdAt;
    }
}
