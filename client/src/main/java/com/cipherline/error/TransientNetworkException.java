package com.cipherline.error;

/** Network or 5xx failure talking to the directory or backup store; safe to retry. */
public class TransientNetworkException extends E2eeException {

    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
