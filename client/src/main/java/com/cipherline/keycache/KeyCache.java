package com.cipherline.keycache;

import com.cipherline.crypto.DeviceKey;
import com.cipherline.directory.KeyDirectoryClient;
import com.cipherline.error.NotAuthenticatedException;
import com.cipherline.error.NotInitializedException;
import com.cipherline.error.PeerKeyNotFoundException;
import com.cipherline.error.StorageUnavailableException;
import com.cipherline.keystore.KeyNames;
import com.cipherline.keystore.SecureKeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two-layer cache of key material: process memory in front of the
 * {@link SecureKeyStore}, with the key directory behind both.
 *
 * <p>Peer slots are replaced whole through {@link ConcurrentHashMap#put}, so a
 * reader never sees a half-written entry. Users the directory answered 404 for
 * are remembered in a negative cache and not asked for again until
 * {@link #clearFailedMarkers()} or {@link #clearFailedMarker(String)} is
 * called, or a later fetch for them succeeds.
 */
public class KeyCache {

    private static final Logger log = LoggerFactory.getLogger(KeyCache.class);

    private final SecureKeyStore store;
    private final KeyDirectoryClient directory;
    private final Scheduler storageScheduler;

    private final AtomicReference<DeviceKey> ownKey = new AtomicReference<>();
    private final ConcurrentHashMap<String, byte[]> peerKeys = new ConcurrentHashMap<>();
    private final Set<String> failedFetches = ConcurrentHashMap.newKeySet();

    public KeyCache(SecureKeyStore store, KeyDirectoryClient directory, Scheduler storageScheduler) {
        this.store = store;
        this.directory = directory;
        this.storageScheduler = storageScheduler;
    }

    // ── Own key ───────────────────────────────────────────────────────────────

    /**
     * Memory, then secure storage.
     *
     * @return the device key, or {@link NotInitializedException} if none exists
     */
    public Mono<DeviceKey> getOwnKey() {
        DeviceKey cached = ownKey.get();
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.fromCallable(() -> store.get(KeyNames.DEVICE_KEY).orElse(null))
                .subscribeOn(storageScheduler)
                .map(bytes -> {
                    DeviceKey loaded = DeviceKey.fromBytes(bytes);
                    log.debug("Loaded device key {} from secure storage", loaded.fingerprint());
                    return ownKey.compareAndSet(null, loaded) ? loaded : ownKey.get();
                })
                .switchIfEmpty(Mono.error(() -> new NotInitializedException("Device key not found")));
    }

    /** Like {@link #getOwnKey()} but completes with an empty optional instead of failing. */
    public Mono<Optional<DeviceKey>> findOwnKey() {
        return getOwnKey()
                .map(Optional::of)
                .onErrorResume(NotInitializedException.class, e -> Mono.just(Optional.empty()));
    }

    /** Persists {@code key} as this device's key, replacing any previous one. */
    public Mono<DeviceKey> installOwnKey(DeviceKey key) {
        return Mono.fromRunnable(() -> store.set(KeyNames.DEVICE_KEY, key.secretBytes()))
                .subscribeOn(storageScheduler)
                .then(Mono.fromCallable(() -> {
                    ownKey.set(key);
                    log.info("Installed device key {}", key.fingerprint());
                    return key;
                }));
    }

    public Mono<Void> deleteOwnKey() {
        return Mono.fromRunnable(() -> store.delete(KeyNames.DEVICE_KEY))
                .subscribeOn(storageScheduler)
                .then(Mono.fromRunnable(this::evictOwnKey));
    }

    public void evictOwnKey() {
        ownKey.set(null);
    }

    // ── Peer keys ─────────────────────────────────────────────────────────────

    /**
     * Memory, then secure storage, then the directory; each hit fills the
     * faster layers. A user in the negative cache fails at once with
     * {@link PeerKeyNotFoundException} without a directory request.
     */
    public Mono<byte[]> getPeerKey(String userId) {
        return Mono.defer(() -> {
            byte[] cached = peerKeys.get(userId);
            if (cached != null) {
                log.debug("Using cached key for {} from memory", userId);
                return Mono.just(cached.clone());
            }
            if (failedFetches.contains(userId)) {
                return Mono.error(new PeerKeyNotFoundException(userId,
                        "No published key for user " + userId + " (cached 404)"));
            }
            return loadPersisted(userId).switchIfEmpty(Mono.defer(() -> fetchAndStore(userId)));
        });
    }

    /** Bypasses both cache layers and overwrites them with the directory's answer. */
    public Mono<byte[]> refreshPeerKey(String userId) {
        return fetchAndStore(userId);
    }

    /**
     * Warms the cache for many users at once. Fetches run concurrently and
     * one failure never cancels the others; only a missing credential aborts
     * the whole call.
     */
    public Mono<PrefetchReport> prefetch(Collection<String> userIds) {
        List<String> distinct = userIds.stream().distinct().toList();
        if (distinct.isEmpty()) {
            return Mono.just(new PrefetchReport(List.of(), List.of(), List.of(), List.of(), List.of()));
        }
        log.debug("Prefetching keys for {} users", distinct.size());
        return Flux.fromIterable(distinct)
                .flatMap(this::prefetchOne, distinct.size())
                .collectList()
                .map(KeyCache::summarize)
                .doOnNext(report -> log.info("Prefetch complete: {} fetched, {} cached, {} skipped, {} not found, {} failed",
                        report.fetched().size(), report.alreadyCached().size(), report.skipped().size(),
                        report.notFound().size(), report.failed().size()));
    }

    private Mono<Outcome> prefetchOne(String userId) {
        if (failedFetches.contains(userId)) {
            log.debug("Skipping {}: previous lookup returned 404", userId);
            return Mono.just(new Outcome(userId, Status.SKIPPED));
        }
        if (peerKeys.containsKey(userId)) {
            return Mono.just(new Outcome(userId, Status.ALREADY_CACHED));
        }
        return loadPersisted(userId)
                .map(bytes -> new Outcome(userId, Status.ALREADY_CACHED))
                .switchIfEmpty(Mono.defer(() -> fetchAndStore(userId).map(bytes -> new Outcome(userId, Status.FETCHED))))
                .onErrorResume(PeerKeyNotFoundException.class, e -> Mono.just(new Outcome(userId, Status.NOT_FOUND)))
                .onErrorResume(e -> !(e instanceof NotAuthenticatedException), e -> {
                    log.warn("Failed to prefetch key for {}: {}", userId, e.getMessage());
                    return Mono.just(new Outcome(userId, Status.FAILED));
                });
    }

    private Mono<byte[]> loadPersisted(String userId) {
        return Mono.fromCallable(() -> store.get(KeyNames.peerKey(userId)).orElse(null))
                .subscribeOn(storageScheduler)
                .doOnNext(bytes -> {
                    peerKeys.put(userId, bytes.clone());
                    log.debug("Loaded key for {} from secure storage", userId);
                });
    }

    private Mono<byte[]> fetchAndStore(String userId) {
        return directory.fetch(userId)
                .flatMap(bytes -> Mono.fromCallable(() -> {
                            persistPeer(userId, bytes);
                            return bytes;
                        })
                        .subscribeOn(storageScheduler))
                .onErrorResume(PeerKeyNotFoundException.class, e -> {
                    failedFetches.add(userId);
                    log.warn("User {} has no published key yet; suppressing further lookups", userId);
                    return Mono.error(e);
                });
    }

    private void persistPeer(String userId, byte[] key) {
        peerKeys.put(userId, key.clone());
        failedFetches.remove(userId);
        try {
            store.set(KeyNames.peerKey(userId), key);
        } catch (StorageUnavailableException e) {
            // the fetched key is valid; only durability across restarts is lost
            log.warn("Could not persist key for {}: {}", userId, e.getMessage());
        }
        log.debug("Cached key for {}", userId);
    }

    // ── Negative cache and reset ──────────────────────────────────────────────

    public boolean isMarkedNotFound(String userId) {
        return failedFetches.contains(userId);
    }

    public void clearFailedMarker(String userId) {
        if (failedFetches.remove(userId)) {
            log.debug("Cleared 404 marker for {}", userId);
        }
    }

    /** Call after anything that suggests peers may have published keys since. */
    public void clearFailedMarkers() {
        failedFetches.clear();
        log.info("Cleared failed-fetch markers");
    }

    /** Removes one peer from memory, the negative cache and secure storage. */
    public Mono<Void> clearPeer(String userId) {
        return Mono.fromRunnable(() -> {
                    peerKeys.remove(userId);
                    failedFetches.remove(userId);
                    store.delete(KeyNames.peerKey(userId));
                    log.info("Cleared key for {}", userId);
                })
                .subscribeOn(storageScheduler)
                .then();
    }

    /**
     * Drops the memory layer and the negative cache. Persisted peer keys stay
     * valid and are reloaded on demand.
     */
    public void reset() {
        peerKeys.clear();
        failedFetches.clear();
        ownKey.set(null);
        log.info("Key cache reset");
    }

    private static PrefetchReport summarize(List<Outcome> outcomes) {
        List<String> fetched = new ArrayList<>();
        List<String> cached = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> notFound = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            switch (outcome.status()) {
                case FETCHED -> fetched.add(outcome.userId());
                case ALREADY_CACHED -> cached.add(outcome.userId());
                case SKIPPED -> skipped.add(outcome.userId());
                case NOT_FOUND -> notFound.add(outcome.userId());
                case FAILED -> failed.add(outcome.userId());
            }
        }
        return new PrefetchReport(fetched, cached, skipped, notFound, failed);
    }

    private enum Status { FETCHED, ALREADY_CACHED, SKIPPED, NOT_FOUND, FAILED }

    private record Outcome(String userId, Status status) {}
}
