package com.cipherline.lifecycle;

import com.cipherline.backup.BackupBlob;
import com.cipherline.backup.BackupService;
import com.cipherline.crypto.DeviceKey;
import com.cipherline.directory.KeyDirectoryClient;
import com.cipherline.error.EncryptionNotReadyException;
import com.cipherline.error.InvalidBackupPasswordException;
import com.cipherline.keycache.KeyCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Establishes the device key at the start of every authenticated session.
 *
 * <p>Which path runs depends on two probes: is there a local key, and does
 * the server hold a backup.
 * <ul>
 *   <li>local key and backup: ready at once</li>
 *   <li>local key, no backup: ready at once, then a delayed re-check before
 *       offering backup creation</li>
 *   <li>backup, no local key: ask for the backup password and restore</li>
 *   <li>neither: generate a key, optionally back it up</li>
 * </ul>
 * Every path that ends in {@link LifecycleState#READY} publishes the public
 * key. Probe failures never block the application: with a local key the
 * manager still becomes ready, without one it stays non-ready and
 * {@link #requireReady()} fails.
 */
public class KeyLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(KeyLifecycleManager.class);

    private final KeyCache keyCache;
    private final BackupService backupService;
    private final KeyDirectoryClient directory;
    private final BackupPrompter prompter;
    private final Duration legacyRecheckDelay;
    private final int maxRestoreAttempts;
    private final Scheduler scheduler;

    private final AtomicReference<LifecycleState> state = new AtomicReference<>(LifecycleState.UNINITIALIZED);
    private final AtomicReference<Disposable> pendingRecheck = new AtomicReference<>();
    private final AtomicReference<Mono<LifecycleState>> inFlightStart = new AtomicReference<>();
    private volatile boolean hasBackup;

    public KeyLifecycleManager(KeyCache keyCache, BackupService backupService, KeyDirectoryClient directory,
                               BackupPrompter prompter, Duration legacyRecheckDelay, int maxRestoreAttempts,
                               Scheduler scheduler) {
        this.keyCache = keyCache;
        this.backupService = backupService;
        this.directory = directory;
        this.prompter = prompter;
        this.legacyRecheckDelay = legacyRecheckDelay;
        this.maxRestoreAttempts = maxRestoreAttempts;
        this.scheduler = scheduler;
    }

    // ── Session start ─────────────────────────────────────────────────────────

    /**
     * Runs session start. Callers that arrive while a start is still running
     * share its result instead of starting a second one.
     */
    public Mono<LifecycleState> start() {
        return Mono.defer(() -> {
            Mono<LifecycleState> running = inFlightStart.get();
            if (running != null) {
                log.debug("Key initialization already in progress; joining it");
                return running;
            }
            AtomicReference<Mono<LifecycleState>> self = new AtomicReference<>();
            Mono<LifecycleState> attempt = initialize()
                    .doFinally(signal -> inFlightStart.compareAndSet(self.get(), null))
                    .cache();
            self.set(attempt);
            if (!inFlightStart.compareAndSet(null, attempt)) {
                return start();
            }
            return attempt;
        });
    }

    private Mono<LifecycleState> initialize() {
        return Mono.zip(keyCache.findOwnKey(), probeBackup())
                .flatMap(probes -> route(probes.getT1(), probes.getT2()))
                .onErrorResume(e -> {
                    log.warn("Key initialization failed, encryption unavailable: {}", e.getMessage());
                    transition(LifecycleState.UNINITIALIZED);
                    return Mono.just(LifecycleState.UNINITIALIZED);
                });
    }

    private Mono<BackupStatus> probeBackup() {
        return backupService.checkHasBackup()
                .map(found -> found ? BackupStatus.PRESENT : BackupStatus.ABSENT)
                .onErrorResume(e -> {
                    log.warn("Could not check for key backup: {}", e.getMessage());
                    return Mono.just(BackupStatus.UNKNOWN);
                });
    }

    private Mono<LifecycleState> route(Optional<DeviceKey> localKey, BackupStatus backup) {
        if (localKey.isPresent()) {
            DeviceKey key = localKey.get();
            if (backup == BackupStatus.PRESENT) {
                transition(LifecycleState.READY_NO_PROMPT);
                return finishReady(key, true);
            }
            if (backup == BackupStatus.ABSENT) {
                transition(LifecycleState.LEGACY_NO_BACKUP);
                return finishReady(key, false).doOnNext(ready -> scheduleLegacyRecheck());
            }
            log.warn("Backup status unknown; continuing with local key {}", key.fingerprint());
            return finishReady(key, false);
        }
        if (backup == BackupStatus.PRESENT) {
            transition(LifecycleState.NEEDS_RESTORE);
            return restore(1);
        }
        if (backup == BackupStatus.ABSENT) {
            transition(LifecycleState.NEW_USER);
            return prompter.requestNewBackupPassword()
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(password -> keyCache.findOwnKey()
                            .flatMap(existing -> existing.isPresent()
                                    ? adoptExistingKey(existing.get(), password)
                                    : createKey(password, false)));
        }
        // generating a key here could orphan a backup we failed to see
        log.warn("No local key and backup status unknown; not generating a key");
        transition(LifecycleState.UNINITIALIZED);
        return Mono.just(LifecycleState.UNINITIALIZED);
    }

    private Mono<LifecycleState> restore(int attempt) {
        return prompter.requestRestorePassword(attempt)
                .flatMap(password -> backupService.restore(password)
                        .flatMap(key -> finishReady(key, true))
                        .onErrorResume(InvalidBackupPasswordException.class, e -> {
                            if (attempt >= maxRestoreAttempts) {
                                log.warn("Backup restore failed after {} attempts", attempt);
                                return Mono.just(LifecycleState.NEEDS_RESTORE);
                            }
                            log.info("Incorrect backup password (attempt {}/{})", attempt, maxRestoreAttempts);
                            return restore(attempt + 1);
                        }))
                .switchIfEmpty(Mono.fromCallable(() -> {
                    log.info("Backup restore cancelled by user");
                    return LifecycleState.NEEDS_RESTORE;
                }))
                .onErrorResume(e -> {
                    log.warn("Backup restore failed: {}", e.getMessage());
                    return Mono.just(LifecycleState.NEEDS_RESTORE);
                });
    }

    /** A key was installed while the new-user prompt was open; keep it. */
    private Mono<LifecycleState> adoptExistingKey(DeviceKey key, Optional<String> password) {
        log.info("Device key {} appeared during setup; not generating another", key.fingerprint());
        return backupIfRequested(password).flatMap(backedUp -> finishReady(key, backedUp));
    }

    // ── Key creation ──────────────────────────────────────────────────────────

    /**
     * Replaces any existing device key with a new one. Messages encrypted to
     * the old key can no longer be read on this device.
     *
     * <p>An existing server backup wraps the old key, so when one exists a
     * password is required and the backup is overwritten with the new key.
     *
     * @param password backup password, or empty to skip backup
     */
    public Mono<LifecycleState> startFresh(Optional<String> password) {
        return Mono.defer(() -> {
            password.ifPresent(backupService::validatePassword);
            Mono<Boolean> allowed = password.isPresent()
                    ? Mono.just(true)
                    : backupService.checkHasBackup().map(found -> !found);
            return allowed.flatMap(ok -> {
                if (!ok) {
                    return Mono.error(new IllegalArgumentException(
                            "A key backup exists for this account; a new backup password is required to replace it"));
                }
                cancelRecheck();
                keyCache.evictOwnKey();
                transition(LifecycleState.NEW_USER);
                return createKey(password, true);
            });
        });
    }

    private Mono<LifecycleState> createKey(Optional<String> password, boolean failOnPublishError) {
        return Mono.defer(() -> {
            DeviceKey key = DeviceKey.generate();
            log.info("Generated device key {}", key.fingerprint());
            return keyCache.installOwnKey(key)
                    .then(backupIfRequested(password))
                    .flatMap(backedUp -> directory.publish(key.publicKey())
                            .then(Mono.fromCallable(() -> markReady(backedUp)))
                            .onErrorResume(e -> {
                                markReady(backedUp);
                                if (failOnPublishError) {
                                    log.error("Could not publish new device key {}", key.fingerprint(), e);
                                    return Mono.error(e);
                                }
                                log.warn("Could not publish new device key {}; will retry next session: {}",
                                        key.fingerprint(), e.getMessage());
                                return Mono.just(LifecycleState.READY);
                            }));
        });
    }

    private Mono<Boolean> backupIfRequested(Optional<String> password) {
        if (password.isEmpty()) {
            log.info("Backup skipped for new device key");
            return Mono.just(false);
        }
        return backupService.createBackup(password.get())
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.warn("Backup of new device key failed: {}", e.getMessage());
                    prompter.offerBackupCreation();
                    return Mono.just(false);
                });
    }

    private Mono<LifecycleState> finishReady(DeviceKey key, boolean backedUp) {
        return directory.publish(key.publicKey())
                .onErrorResume(e -> {
                    log.warn("Could not republish device key {}: {}", key.fingerprint(), e.getMessage());
                    return Mono.empty();
                })
                .then(Mono.fromCallable(() -> markReady(backedUp)));
    }

    private LifecycleState markReady(boolean backedUp) {
        hasBackup = backedUp;
        transition(LifecycleState.READY);
        return LifecycleState.READY;
    }

    // ── Legacy re-check ───────────────────────────────────────────────────────

    private void scheduleLegacyRecheck() {
        Disposable recheck = Mono.delay(legacyRecheckDelay, scheduler)
                .then(Mono.defer(backupService::checkHasBackup))
                .subscribe(found -> {
                    if (found) {
                        hasBackup = true;
                        log.info("Backup found on re-check; no prompt needed");
                    } else if (isReady()) {
                        prompter.offerBackupCreation();
                    }
                }, e -> log.warn("Backup re-check failed: {}", e.getMessage()));
        Disposable previous = pendingRecheck.getAndSet(recheck);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void cancelRecheck() {
        Disposable previous = pendingRecheck.getAndSet(null);
        if (previous != null) {
            previous.dispose();
        }
    }

    // ── Ready state ───────────────────────────────────────────────────────────

    public Mono<BackupBlob> createBackupNow(String password) {
        return Mono.defer(() -> {
            requireReady();
            return backupService.createBackup(password)
                    .doOnNext(blob -> {
                        hasBackup = true;
                        cancelRecheck();
                    });
        });
    }

    /** Deletes the device key and forgets all cached keys. */
    public Mono<Void> signOut() {
        return Mono.defer(() -> {
            cancelRecheck();
            inFlightStart.set(null);
            return keyCache.deleteOwnKey()
                    .then(Mono.fromRunnable(() -> {
                        keyCache.reset();
                        hasBackup = false;
                        transition(LifecycleState.UNINITIALIZED);
                    }));
        });
    }

    public void requireReady() {
        if (!isReady()) {
            throw new EncryptionNotReadyException("Encryption is not ready (state " + state.get() + ")");
        }
    }

    public boolean isReady() {
        return state.get() == LifecycleState.READY;
    }

    public boolean hasBackup() {
        return hasBackup;
    }

    public LifecycleState state() {
        return state.get();
    }

    private void transition(LifecycleState next) {
        LifecycleState previous = state.getAndSet(next);
        if (previous != next) {
            log.info("Key lifecycle {} -> {}", previous, next);
        }
    }

    private enum BackupStatus { PRESENT, ABSENT, UNKNOWN }
}
