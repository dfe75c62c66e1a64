package com.cipherline.error;

/** File cipher was invoked without key material. */
public class MissingKeyException extends E2eeException {

    public MissingKeyException(String message) {
        super(message);
    }

    public MissingKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
