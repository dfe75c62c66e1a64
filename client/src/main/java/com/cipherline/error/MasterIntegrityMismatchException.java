package com.cipherline.error;

/** Whole-file tag did not verify. No chunk was decrypted. */
public class MasterIntegrityMismatchException extends E2eeException {

    public MasterIntegrityMismatchException(String message) {
        super(message);
    }

    public MasterIntegrityMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
