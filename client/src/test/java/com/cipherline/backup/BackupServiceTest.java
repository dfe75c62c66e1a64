package com.cipherline.backup;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.crypto.DeviceKey;
import com.cipherline.directory.KeyDirectoryClient;
import com.cipherline.error.BackupNotFoundException;
import com.cipherline.error.InvalidBackupPasswordException;
import com.cipherline.error.NotInitializedException;
import com.cipherline.keycache.KeyCache;
import com.cipherline.keystore.InMemorySecureKeyStore;
import com.cipherline.keystore.KeyNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class BackupServiceTest {

    private static final String PASSWORD = "correct horse battery";
    private static final int ITERATIONS = 1000;

    @Mock
    private KeyDirectoryClient directory;

    private InMemorySecureKeyStore store;
    private InMemoryBackupStorage storage;
    private KeyCache keyCache;
    private BackupService backupService;

    @BeforeEach
    void setup() {
        store = new InMemorySecureKeyStore();
        storage = new InMemoryBackupStorage();
        keyCache = new KeyCache(store, directory, Schedulers.immediate());
        backupService = new BackupService(storage, keyCache, Schedulers.immediate(), ITERATIONS, 8);
    }

    // ── Wrap / unwrap ─────────────────────────────────────────────────────────

    @Test
    void unwrapWithCorrectPasswordRecoversKey() {
        DeviceKey key = DeviceKey.generate();

        DeviceKey recovered = backupService.unwrap(backupService.wrap(key, PASSWORD), PASSWORD);

        assertTrue(key.sameSecretAs(recovered));
    }

    @Test
    void unwrapWithWrongPasswordNeverYieldsAKey() {
        BackupBlob blob = backupService.wrap(DeviceKey.generate(), PASSWORD);

        assertThrows(InvalidBackupPasswordException.class, () -> backupService.unwrap(blob, "wrong password"));
        assertThrows(InvalidBackupPasswordException.class, () -> backupService.unwrap(blob, ""));
    }

    @Test
    void corruptedBlobIsInvalidPassword() {
        BackupBlob blob = backupService.wrap(DeviceKey.generate(), PASSWORD);
        byte[] tag = CryptoPrimitives.fromBase64(blob.authTag());
        tag[3] ^= 0x10;
        BackupBlob tampered = new BackupBlob(blob.encryptedMasterKey(), blob.salt(), blob.iv(),
                CryptoPrimitives.toBase64(tag), blob.keyVersion(), blob.iterations(), blob.createdAt());
        BackupBlob garbled = new BackupBlob("***", blob.salt(), blob.iv(), blob.authTag(),
                blob.keyVersion(), blob.iterations(), blob.createdAt());
        BackupBlob incomplete = new BackupBlob(blob.encryptedMasterKey(), null, blob.iv(), blob.authTag(),
                blob.keyVersion(), blob.iterations(), blob.createdAt());

        assertThrows(InvalidBackupPasswordException.class, () -> backupService.unwrap(tampered, PASSWORD));
        assertThrows(InvalidBackupPasswordException.class, () -> backupService.unwrap(garbled, PASSWORD));
        assertThrows(InvalidBackupPasswordException.class, () -> backupService.unwrap(incomplete, PASSWORD));
    }

    @Test
    void blobCarriesFormatMetadata() {
        BackupBlob blob = backupService.wrap(DeviceKey.generate(), PASSWORD);

        assertEquals(16, CryptoPrimitives.fromBase64(blob.salt()).length);
        assertEquals(12, CryptoPrimitives.fromBase64(blob.iv()).length);
        assertEquals(16, CryptoPrimitives.fromBase64(blob.authTag()).length);
        assertEquals(32, CryptoPrimitives.fromBase64(blob.encryptedMasterKey()).length);
        assertEquals(1, blob.keyVersion());
        assertEquals(ITERATIONS, blob.iterations());
        assertNotNull(Instant.parse(blob.createdAt()));
    }

    @Test
    void eachWrapUsesFreshSaltAndIv() {
        DeviceKey key = DeviceKey.generate();

        BackupBlob first = backupService.wrap(key, PASSWORD);
        BackupBlob second = backupService.wrap(key, PASSWORD);

        assertNotEquals(first.salt(), second.salt());
        assertNotEquals(first.iv(), second.iv());
        assertNotEquals(first.encryptedMasterKey(), second.encryptedMasterKey());
    }

    // ── createBackup / restore ────────────────────────────────────────────────

    @Test
    void createBackupThenRestoreOnNewDevice() {
        DeviceKey key = DeviceKey.generate();
        StepVerifier.create(keyCache.installOwnKey(key)).expectNextCount(1).verifyComplete();

        StepVerifier.create(backupService.createBackup(PASSWORD))
                .expectNextCount(1)
                .verifyComplete();
        StepVerifier.create(backupService.checkHasBackup())
                .expectNext(true)
                .verifyComplete();

        InMemorySecureKeyStore newDevice = new InMemorySecureKeyStore();
        KeyCache newCache = new KeyCache(newDevice, directory, Schedulers.immediate());
        BackupService newService = new BackupService(storage, newCache, Schedulers.immediate(), ITERATIONS, 8);

        StepVerifier.create(newService.restore(PASSWORD))
                .assertNext(restored -> assertTrue(key.sameSecretAs(restored)))
                .verifyComplete();
        assertArrayEquals(key.secretBytes(), newDevice.get(KeyNames.DEVICE_KEY).orElseThrow());
    }

    @Test
    void restoreWithWrongPasswordInstallsNothing() {
        storage.upload(backupService.wrap(DeviceKey.generate(), PASSWORD)).block();

        StepVerifier.create(backupService.restore("not the password"))
                .expectError(InvalidBackupPasswordException.class)
                .verify();
        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty());
    }

    @Test
    void restoreWithoutBackupIsNotFound() {
        StepVerifier.create(backupService.restore(PASSWORD))
                .expectError(BackupNotFoundException.class)
                .verify();
    }

    @Test
    void shortPasswordIsRejectedBeforeUpload() {
        StepVerifier.create(keyCache.installOwnKey(DeviceKey.generate())).expectNextCount(1).verifyComplete();

        StepVerifier.create(backupService.createBackup("short"))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertEquals(0, storage.uploads());
    }

    @Test
    void createBackupWithoutDeviceKeyFails() {
        StepVerifier.create(backupService.createBackup(PASSWORD))
                .expectError(NotInitializedException.class)
                .verify();
        assertNull(storage.stored());
    }
}
