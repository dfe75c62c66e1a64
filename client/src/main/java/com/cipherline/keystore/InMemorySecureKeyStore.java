package com.cipherline.keystore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Selected with {@code cipherline.keystore.type=memory};
 * nothing survives a restart.
 */
public class InMemorySecureKeyStore implements SecureKeyStore {

    private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String name) {
        byte[] value = entries.get(name);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(String name, byte[] value) {
        entries.put(name, value.clone());
    }

    @Override
    public void delete(String name) {
        entries.remove(name);
    }
}
