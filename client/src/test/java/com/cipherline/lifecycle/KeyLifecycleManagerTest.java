package com.cipherline.lifecycle;

import com.cipherline.backup.BackupService;
import com.cipherline.backup.BackupStorage;
import com.cipherline.backup.InMemoryBackupStorage;
import com.cipherline.crypto.DeviceKey;
import com.cipherline.directory.KeyDirectoryClient;
import com.cipherline.error.EncryptionNotReadyException;
import com.cipherline.error.TransientNetworkException;
import com.cipherline.keycache.KeyCache;
import com.cipherline.keystore.InMemorySecureKeyStore;
import com.cipherline.keystore.KeyNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * The four session-start scenarios plus the failure paths around them.
 * Secure storage and backup storage are in-memory; the directory and the
 * prompter are mocks.
 */
@ExtendWith(MockitoExtension.class)
class KeyLifecycleManagerTest {

    private static final String PASSWORD = "backup-password-1";
    private static final Duration RECHECK = Duration.ofSeconds(2);

    @Mock
    private KeyDirectoryClient directory;

    @Mock
    private BackupPrompter prompter;

    private InMemorySecureKeyStore store;
    private KeyCache keyCache;
    private VirtualTimeScheduler clock;

    @BeforeEach
    void setup() {
        store = new InMemorySecureKeyStore();
        keyCache = new KeyCache(store, directory, Schedulers.immediate());
        clock = VirtualTimeScheduler.create();
        lenient().when(directory.publish(any())).thenReturn(Mono.empty());
    }

    @AfterEach
    void tearDown() {
        clock.dispose();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private BackupService backupService(BackupStorage storage) {
        return new BackupService(storage, keyCache, Schedulers.immediate(), 1000, 8);
    }

    private KeyLifecycleManager manager(BackupService backupService) {
        return new KeyLifecycleManager(keyCache, backupService, directory, prompter, RECHECK, 3, clock);
    }

    private DeviceKey givenLocalKey() {
        DeviceKey key = DeviceKey.generate();
        store.set(KeyNames.DEVICE_KEY, key.secretBytes());
        return key;
    }

    // ── New user ──────────────────────────────────────────────────────────────

    @Test
    void newUserWithPasswordGetsKeyAndRetrievableBackup() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        BackupService backupService = backupService(storage);
        KeyLifecycleManager manager = manager(backupService);
        when(prompter.requestNewBackupPassword()).thenReturn(Mono.just(PASSWORD));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(manager.isReady());
        assertTrue(manager.hasBackup());
        byte[] secret = store.get(KeyNames.DEVICE_KEY).orElseThrow();
        DeviceKey created = DeviceKey.fromBytes(secret);
        verify(directory).publish(created.publicKey());
        StepVerifier.create(backupService.checkHasBackup()).expectNext(true).verifyComplete();
        assertTrue(created.sameSecretAs(backupService.unwrap(storage.stored(), PASSWORD)));
    }

    @Test
    void newUserMaySkipBackup() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        KeyLifecycleManager manager = manager(backupService(storage));
        when(prompter.requestNewBackupPassword()).thenReturn(Mono.empty());

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(manager.isReady());
        assertFalse(manager.hasBackup());
        assertNull(storage.stored());
        assertTrue(store.get(KeyNames.DEVICE_KEY).isPresent());
    }

    @Test
    void newUserStaysReadyWhenPublishFails() {
        when(directory.publish(any())).thenReturn(Mono.error(new TransientNetworkException("503")));
        when(prompter.requestNewBackupPassword()).thenReturn(Mono.empty());
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();
    }

    @Test
    void newUserWithTooShortPasswordIsOfferedBackupLater() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        when(prompter.requestNewBackupPassword()).thenReturn(Mono.just("short"));
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertFalse(manager.hasBackup());
        assertNull(storage.stored());
        verify(prompter).offerBackupCreation();
    }

    // ── Returning user ────────────────────────────────────────────────────────

    @Test
    void localKeyAndBackupIsReadyWithoutPrompt() {
        DeviceKey key = givenLocalKey();
        KeyLifecycleManager manager = manager(backupService(
                new InMemoryBackupStorage(backupService(new InMemoryBackupStorage()).wrap(key, PASSWORD))));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(manager.hasBackup());
        verify(directory).publish(key.publicKey());
        clock.advanceTimeBy(RECHECK.multipliedBy(2));
        verifyNoInteractions(prompter);
    }

    // ── Legacy user ───────────────────────────────────────────────────────────

    @Test
    void legacyUserIsReadyThenOfferedBackupAfterRecheck() {
        givenLocalKey();
        BackupStorage storage = mock(BackupStorage.class);
        when(storage.hasBackup()).thenReturn(Mono.just(false));
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(manager.isReady());
        verify(prompter, never()).offerBackupCreation();

        clock.advanceTimeBy(RECHECK);

        verify(prompter, times(1)).offerBackupCreation();
        verify(storage, times(2)).hasBackup();
    }

    @Test
    void legacyUserIsNotPromptedWhenBackupAppearsBeforeRecheck() {
        givenLocalKey();
        BackupStorage storage = mock(BackupStorage.class);
        when(storage.hasBackup()).thenReturn(Mono.just(false), Mono.just(true));
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();
        clock.advanceTimeBy(RECHECK);

        verify(prompter, never()).offerBackupCreation();
        assertTrue(manager.hasBackup());
    }

    @Test
    void createBackupNowCancelsPendingOffer() {
        givenLocalKey();
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start()).expectNext(LifecycleState.READY).verifyComplete();
        StepVerifier.create(manager.createBackupNow(PASSWORD)).expectNextCount(1).verifyComplete();
        clock.advanceTimeBy(RECHECK);

        assertTrue(manager.hasBackup());
        assertNotNull(storage.stored());
        verify(prompter, never()).offerBackupCreation();
    }

    // ── Restore ───────────────────────────────────────────────────────────────

    @Test
    void restoreRetriesAfterWrongPassword() {
        DeviceKey original = DeviceKey.generate();
        InMemoryBackupStorage storage = new InMemoryBackupStorage(backupService(new InMemoryBackupStorage()).wrap(original, PASSWORD));
        KeyLifecycleManager manager = manager(backupService(storage));
        when(prompter.requestRestorePassword(1)).thenReturn(Mono.just("wrong-password"));
        when(prompter.requestRestorePassword(2)).thenReturn(Mono.just(PASSWORD));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(manager.hasBackup());
        assertArrayEquals(original.secretBytes(), store.get(KeyNames.DEVICE_KEY).orElseThrow());
        verify(directory).publish(original.publicKey());
    }

    @Test
    void cancelledRestoreStaysNonReady() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage(backupService(new InMemoryBackupStorage()).wrap(DeviceKey.generate(), PASSWORD));
        KeyLifecycleManager manager = manager(backupService(storage));
        when(prompter.requestRestorePassword(1)).thenReturn(Mono.empty());

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.NEEDS_RESTORE)
                .verifyComplete();

        assertFalse(manager.isReady());
        assertThrows(EncryptionNotReadyException.class, manager::requireReady);
        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty(), "No key may be generated over an existing backup");
    }

    @Test
    void restoreGivesUpAfterMaxAttempts() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage(backupService(new InMemoryBackupStorage()).wrap(DeviceKey.generate(), PASSWORD));
        KeyLifecycleManager manager = manager(backupService(storage));
        when(prompter.requestRestorePassword(anyInt())).thenReturn(Mono.just("wrong-password"));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.NEEDS_RESTORE)
                .verifyComplete();

        verify(prompter, times(3)).requestRestorePassword(anyInt());
        verify(prompter, never()).requestRestorePassword(4);
        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty());
    }

    // ── Probe failures ────────────────────────────────────────────────────────

    @Test
    void unknownBackupStatusWithoutLocalKeyStaysUninitialized() {
        BackupStorage storage = mock(BackupStorage.class);
        when(storage.hasBackup()).thenReturn(Mono.error(new TransientNetworkException("offline")));
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.UNINITIALIZED)
                .verifyComplete();

        assertFalse(manager.isReady());
        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty());
        verifyNoInteractions(prompter);
    }

    @Test
    void unknownBackupStatusWithLocalKeyIsReady() {
        givenLocalKey();
        BackupStorage storage = mock(BackupStorage.class);
        when(storage.hasBackup()).thenReturn(Mono.error(new TransientNetworkException("offline")));
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();
        assertFalse(manager.hasBackup());
    }

    @Test
    void republishFailureIsAbsorbedForExistingKey() {
        givenLocalKey();
        when(directory.publish(any())).thenReturn(Mono.error(new TransientNetworkException("503")));
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.start())
                .expectNext(LifecycleState.READY)
                .verifyComplete();
    }

    // ── Overlapping starts ────────────────────────────────────────────────────

    @Test
    void overlappingStartsShareOneKeyGeneration() {
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        BackupService backupService = backupService(storage);
        KeyLifecycleManager manager = manager(backupService);
        Sinks.One<String> password = Sinks.one();
        when(prompter.requestNewBackupPassword()).thenReturn(password.asMono());

        StepVerifier.create(Mono.zip(manager.start(), manager.start()))
                .then(() -> password.tryEmitValue(PASSWORD))
                .assertNext(states -> {
                    assertEquals(LifecycleState.READY, states.getT1());
                    assertEquals(LifecycleState.READY, states.getT2());
                })
                .verifyComplete();

        verify(prompter, times(1)).requestNewBackupPassword();
        verify(directory, times(1)).publish(any());
        assertEquals(1, storage.uploads());
        DeviceKey stored = DeviceKey.fromBytes(store.get(KeyNames.DEVICE_KEY).orElseThrow());
        verify(directory).publish(stored.publicKey());
        assertTrue(stored.sameSecretAs(backupService.unwrap(storage.stored(), PASSWORD)));
    }

    @Test
    void keyInstalledWhileNewUserPromptIsOpenIsKept() {
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));
        Sinks.One<String> password = Sinks.one();
        when(prompter.requestNewBackupPassword()).thenReturn(password.asMono());
        DeviceKey installed = DeviceKey.generate();

        StepVerifier.create(manager.start())
                .then(() -> keyCache.installOwnKey(installed).block())
                .then(() -> password.tryEmitEmpty())
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        assertTrue(installed.sameSecretAs(DeviceKey.fromBytes(store.get(KeyNames.DEVICE_KEY).orElseThrow())));
        verify(directory, times(1)).publish(any());
        verify(directory).publish(installed.publicKey());
    }

    @Test
    void startAfterCompletedStartRunsAgain() {
        givenLocalKey();
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.start()).expectNext(LifecycleState.READY).verifyComplete();
        StepVerifier.create(manager.start()).expectNext(LifecycleState.READY).verifyComplete();

        verify(directory, times(2)).publish(any());
    }

    // ── Start fresh / sign out ────────────────────────────────────────────────

    @Test
    void startFreshReplacesKey() {
        DeviceKey old = givenLocalKey();
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        KeyLifecycleManager manager = manager(backupService(storage));

        StepVerifier.create(manager.startFresh(Optional.of(PASSWORD)))
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        DeviceKey current = DeviceKey.fromBytes(store.get(KeyNames.DEVICE_KEY).orElseThrow());
        assertFalse(old.sameSecretAs(current));
        assertTrue(manager.hasBackup());
        assertNotNull(storage.stored());
    }

    @Test
    void startFreshPropagatesPublishFailureButIsReady() {
        when(directory.publish(any())).thenReturn(Mono.error(new TransientNetworkException("503")));
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.startFresh(Optional.empty()))
                .expectError(TransientNetworkException.class)
                .verify();

        assertTrue(manager.isReady());
    }

    @Test
    void startFreshRejectsShortPasswordBeforeGenerating() {
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.startFresh(Optional.of("short")))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty());
    }

    @Test
    void startFreshWithoutPasswordIsRejectedWhileBackupExists() {
        DeviceKey old = givenLocalKey();
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        BackupService backupService = backupService(storage);
        backupService.createBackup(PASSWORD).block();
        KeyLifecycleManager manager = manager(backupService);

        StepVerifier.create(manager.startFresh(Optional.empty()))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertTrue(old.sameSecretAs(DeviceKey.fromBytes(store.get(KeyNames.DEVICE_KEY).orElseThrow())));
        assertTrue(old.sameSecretAs(backupService.unwrap(storage.stored(), PASSWORD)));
        verify(directory, never()).publish(any());
    }

    @Test
    void startFreshWithPasswordOverwritesExistingBackup() {
        DeviceKey old = givenLocalKey();
        InMemoryBackupStorage storage = new InMemoryBackupStorage();
        BackupService backupService = backupService(storage);
        backupService.createBackup(PASSWORD).block();
        KeyLifecycleManager manager = manager(backupService);

        StepVerifier.create(manager.startFresh(Optional.of("replacement-pass")))
                .expectNext(LifecycleState.READY)
                .verifyComplete();

        DeviceKey current = DeviceKey.fromBytes(store.get(KeyNames.DEVICE_KEY).orElseThrow());
        assertFalse(old.sameSecretAs(current));
        assertTrue(current.sameSecretAs(backupService.unwrap(storage.stored(), "replacement-pass")));
        assertEquals(2, storage.uploads());
        assertTrue(manager.hasBackup());
    }

    @Test
    void signOutWipesKeyAndReturnsToUninitialized() {
        givenLocalKey();
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));
        StepVerifier.create(manager.start()).expectNext(LifecycleState.READY).verifyComplete();

        StepVerifier.create(manager.signOut()).verifyComplete();

        assertEquals(LifecycleState.UNINITIALIZED, manager.state());
        assertFalse(manager.hasBackup());
        assertTrue(store.get(KeyNames.DEVICE_KEY).isEmpty());
        clock.advanceTimeBy(RECHECK);
        verify(prompter, never()).offerBackupCreation();
    }

    @Test
    void createBackupNowRequiresReady() {
        KeyLifecycleManager manager = manager(backupService(new InMemoryBackupStorage()));

        StepVerifier.create(manager.createBackupNow(PASSWORD))
                .expectError(EncryptionNotReadyException.class)
                .verify();
    }
}
