package com.cipherline.directory;

import reactor.core.publisher.Mono;

/**
 * Publishes this device's key and looks up peers' keys.
 *
 * <p>{@link #fetch(String)} fails with
 * {@link com.cipherline.error.PeerKeyNotFoundException} when the directory has
 * nothing for the user, and with
 * {@link com.cipherline.error.TransientNetworkException} on network or 5xx
 * trouble. The key cache relies on that distinction.
 */
public interface KeyDirectoryClient {

    /** Idempotent: republishing the same key is a no-op for the directory. */
    Mono<Void> publish(byte[] publicKey);

    Mono<byte[]> fetch(String userId);
}
