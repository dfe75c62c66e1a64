package com.cipherline.error;

/**
 * Root of every failure the encryption subsystem reports.
 * Unchecked so it can travel through Reactor error signals unchanged.
 */
public abstract class E2eeException extends RuntimeException {

    protected E2eeException(String message) {
        super(message);
    }

    protected E2eeException(String message, Throwable cause) {
        super(message, cause);
    }
}
