package com.cipherline.error;

/** No bearer credential is available. Never retried. */
public class NotAuthenticatedException extends E2eeException {

    public NotAuthenticatedException(String message) {
        super(message);
    }

    public NotAuthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
