package com.cipherline.message;

import reactor.core.publisher.Mono;

/**
 * Supplies the symmetric key for a decryption once the envelope has been
 * accepted, so no key lookup happens for malformed input.
 */
@FunctionalInterface
public interface KeyResolver {

    Mono<byte[]> resolve();
}
