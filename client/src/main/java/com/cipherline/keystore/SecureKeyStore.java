package com.cipherline.keystore;

import java.util.Optional;

/**
 * Local secure storage for the device key and cached peer keys.
 *
 * <p>Calls are blocking and local; a value once set stays retrievable until
 * {@link #delete(String)} is called. Implementations never return an empty
 * result to hide a storage fault.
 *
 * @throws com.cipherline.error.StorageUnavailableException from every method
 *         when the backing storage cannot be read or written
 */
public interface SecureKeyStore {

    Optional<byte[]> get(String name);

    void set(String name, byte[] value);

    void delete(String name);
}
