package com.cipherline.backup;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.crypto.DeviceKey;
import com.cipherline.error.BackupNotFoundException;
import com.cipherline.error.InvalidBackupPasswordException;
import com.cipherline.keycache.KeyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;

/**
 * Wraps the device key under a password for server-side storage and unwraps
 * it on a new installation.
 *
 * <p>The wrapping key is PBKDF2-HMAC-SHA256 over the password with a fresh
 * 16-byte salt; the device key is sealed with AES-256-GCM under a fresh
 * 12-byte IV. A wrong password and a corrupted blob are indistinguishable
 * and both surface as {@link InvalidBackupPasswordException}.
 */
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    static final int SALT_SIZE = 16;
    static final int KEY_VERSION = 1;

    private final BackupStorage storage;
    private final KeyCache keyCache;
    private final Scheduler cryptoScheduler;
    private final int iterations;
    private final int minPasswordLength;

    public BackupService(BackupStorage storage, KeyCache keyCache, Scheduler cryptoScheduler,
                         int iterations, int minPasswordLength) {
        this.storage = storage;
        this.keyCache = keyCache;
        this.cryptoScheduler = cryptoScheduler;
        this.iterations = iterations;
        this.minPasswordLength = minPasswordLength;
    }

    /**
     * Wraps the current device key and uploads it, replacing any earlier backup.
     *
     * @throws IllegalArgumentException (as an error signal) if the password is too short
     */
    public Mono<BackupBlob> createBackup(String password) {
        return Mono.defer(() -> {
            validatePassword(password);
            return keyCache.getOwnKey()
                    .publishOn(cryptoScheduler)
                    .map(key -> wrap(key, password))
                    .flatMap(blob -> storage.upload(blob).thenReturn(blob))
                    .doOnNext(blob -> log.info("Key backup stored"));
        });
    }

    /**
     * Downloads the backup, unwraps it and installs the recovered key as
     * this device's key.
     */
    public Mono<DeviceKey> restore(String password) {
        return storage.download()
                .switchIfEmpty(Mono.error(() -> new BackupNotFoundException("No key backup exists for this account")))
                .publishOn(cryptoScheduler)
                .map(blob -> unwrap(blob, password))
                .flatMap(keyCache::installOwnKey)
                .doOnNext(key -> log.info("Restored device key {} from backup", key.fingerprint()));
    }

    public Mono<Boolean> checkHasBackup() {
        return storage.hasBackup();
    }

    public void validatePassword(String password) {
        if (password == null || password.length() < minPasswordLength) {
            throw new IllegalArgumentException(
                    "Backup password must be at least " + minPasswordLength + " characters");
        }
    }

    public BackupBlob wrap(DeviceKey key, String password) {
        byte[] salt = CryptoPrimitives.randomBytes(SALT_SIZE);
        byte[] iv = CryptoPrimitives.randomBytes(CryptoPrimitives.GCM_IV_SIZE);
        byte[] wrappingKey = CryptoPrimitives.pbkdf2Sha256(password, salt, iterations);
        byte[] secret = key.secretBytes();
        try {
            byte[][] sealed = CryptoPrimitives.aesGcmEncrypt(wrappingKey, iv, secret);
            return new BackupBlob(
                    CryptoPrimitives.toBase64(sealed[0]),
                    CryptoPrimitives.toBase64(salt),
                    CryptoPrimitives.toBase64(iv),
                    CryptoPrimitives.toBase64(sealed[1]),
                    KEY_VERSION,
                    iterations,
                    Instant.now().toString());
        } finally {
            Arrays.fill(wrappingKey, (byte) 0);
            Arrays.fill(secret, (byte) 0);
        }
    }

    public DeviceKey unwrap(BackupBlob blob, String password) {
        if (password == null || password.isEmpty()) {
            throw new InvalidBackupPasswordException("Password is required");
        }
        if (blob.salt() == null || blob.iv() == null || blob.encryptedMasterKey() == null || blob.authTag() == null) {
            throw new InvalidBackupPasswordException("Backup is missing required fields");
        }
        byte[] wrappingKey = null;
        byte[] secret = null;
        try {
            byte[] salt = CryptoPrimitives.fromBase64(blob.salt());
            byte[] iv = CryptoPrimitives.fromBase64(blob.iv());
            byte[] ciphertext = CryptoPrimitives.fromBase64(blob.encryptedMasterKey());
            byte[] tag = CryptoPrimitives.fromBase64(blob.authTag());
            int rounds = blob.iterations() > 0 ? blob.iterations() : iterations;
            wrappingKey = CryptoPrimitives.pbkdf2Sha256(password, salt, rounds);
            secret = CryptoPrimitives.aesGcmDecrypt(wrappingKey, iv, ciphertext, tag);
            return DeviceKey.fromBytes(secret);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new InvalidBackupPasswordException("Invalid password or corrupted backup", e);
        } finally {
            if (wrappingKey != null) {
                Arrays.fill(wrappingKey, (byte) 0);
            }
            if (secret != null) {
                Arrays.fill(secret, (byte) 0);
            }
        }
    }
}
