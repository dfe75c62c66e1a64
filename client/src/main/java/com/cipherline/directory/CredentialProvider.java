package com.cipherline.directory;

import reactor.core.publisher.Mono;

/**
 * Supplies the bearer credential for directory and backup calls.
 * Completes empty when nobody is signed in.
 */
@FunctionalInterface
public interface CredentialProvider {

    Mono<String> bearerToken();
}
