package com.cipherline.directory;

import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the token the host application hands over at sign-in.
 */
public class SessionCredentialProvider implements CredentialProvider {

    private final AtomicReference<String> token = new AtomicReference<>();

    public void signIn(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IllegalArgumentException("Bearer token must not be blank");
        }
        token.set(bearerToken);
    }

    public void signOut() {
        token.set(null);
    }

    @Override
    public Mono<String> bearerToken() {
        return Mono.justOrEmpty(token.get());
    }
}
