package com.cipherline.error;

/** Secure storage could not be read or written. */
public class StorageUnavailableException extends E2eeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
