package com.cipherline.keystore;

import com.cipherline.error.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Password-protected PKCS#12 file holding every value as a secret-key entry.
 *
 * <p>PKCS#12 lower-cases aliases, so names are stored hex-encoded. Each write
 * goes to a sibling temp file and is then moved over the original, so a crash
 * never leaves a half-written store.
 */
public class Pkcs12SecureKeyStore implements SecureKeyStore {

    private static final Logger log = LoggerFactory.getLogger(Pkcs12SecureKeyStore.class);
    private static final String TYPE = "PKCS12";

    private final Path path;
    private final char[] password;
    private KeyStore keyStore;

    public Pkcs12SecureKeyStore(Path path, char[] password) {
        this.path = path;
        this.password = password.clone();
    }

    @Override
    public synchronized Optional<byte[]> get(String name) {
        try {
            Key key = loaded().getKey(alias(name), password);
            return key == null ? Optional.empty() : Optional.of(key.getEncoded());
        } catch (GeneralSecurityException e) {
            throw new StorageUnavailableException("Cannot read '" + name + "' from " + path, e);
        }
    }

    @Override
    public synchronized void set(String name, byte[] value) {
        try {
            loaded().setEntry(alias(name),
                    new KeyStore.SecretKeyEntry(new SecretKeySpec(value, "AES")),
                    new KeyStore.PasswordProtection(password));
        } catch (GeneralSecurityException e) {
            throw new StorageUnavailableException("Cannot write '" + name + "' to " + path, e);
        }
        persist();
    }

    @Override
    public synchronized void delete(String name) {
        try {
            KeyStore store = loaded();
            String alias = alias(name);
            if (!store.containsAlias(alias)) {
                return;
            }
            store.deleteEntry(alias);
        } catch (GeneralSecurityException e) {
            throw new StorageUnavailableException("Cannot delete '" + name + "' from " + path, e);
        }
        persist();
    }

    private KeyStore loaded() {
        if (keyStore != null) {
            return keyStore;
        }
        try {
            KeyStore store = KeyStore.getInstance(TYPE);
            if (Files.exists(path)) {
                try (InputStream in = Files.newInputStream(path)) {
                    store.load(in, password);
                }
                log.debug("Opened key store {}", path);
            } else {
                store.load(null, password);
                log.info("Creating new key store at {}", path);
            }
            keyStore = store;
            return store;
        } catch (IOException | GeneralSecurityException e) {
            throw new StorageUnavailableException("Key store " + path + " is unavailable", e);
        }
    }

    private void persist() {
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(temp)) {
                keyStore.store(out, password);
            }
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | GeneralSecurityException e) {
            // the in-memory view is ahead of disk now; force a reload next time
            keyStore = null;
            throw new StorageUnavailableException("Cannot persist key store " + path, e);
        }
    }

    private static String alias(String name) {
        return HexFormat.of().formatHex(name.getBytes(StandardCharsets.UTF_8));
    }
}
