package com.cipherline.error;

/** User content was submitted before the device key was established. */
public class EncryptionNotReadyException extends E2eeException {

    public EncryptionNotReadyException(String message) {
        super(message);
    }

    public EncryptionNotReadyException(String message, Throwable cause) {
        super(message, cause);
    }
}
