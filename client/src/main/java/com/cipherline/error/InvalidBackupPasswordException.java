package com.cipherline.error;

/** Wrong password or a corrupted backup blob. */
public class InvalidBackupPasswordException extends E2eeException {

    public InvalidBackupPasswordException(String message) {
        super(message);
    }

    public InvalidBackupPasswordException(String message, Throwable cause) {
        super(message, cause);
    }
}
