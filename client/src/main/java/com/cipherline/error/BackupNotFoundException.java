package com.cipherline.error;

/** Restore was requested but the server holds no backup for this user. */
public class BackupNotFoundException extends E2eeException {

    public BackupNotFoundException(String message) {
        super(message);
    }

    public BackupNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
