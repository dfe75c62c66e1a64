package com.cipherline.error;

/** No device key exists locally yet. */
public class NotInitializedException extends E2eeException {

    public NotInitializedException(String message) {
        super(message);
    }

    public NotInitializedException(String message, Throwable cause) {
        super(message, cause);
    }
}
