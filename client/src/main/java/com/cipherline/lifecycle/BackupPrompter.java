package com.cipherline.lifecycle;

import reactor.core.publisher.Mono;

/**
 * User-facing side of key setup. Implementations show dialogs; the lifecycle
 * manager only reacts to what they return.
 */
public interface BackupPrompter {

    /**
     * Asks for the password of an existing backup.
     *
     * @param attempt 1 for the first request, incremented after each wrong password
     * @return the password, or empty if the user cancelled
     */
    Mono<String> requestRestorePassword(int attempt);

    /**
     * Offers a new user the chance to protect their fresh key.
     *
     * @return the password, or empty if the user skipped backup
     */
    Mono<String> requestNewBackupPassword();

    /** Suggests creating a backup. Must not block. */
    void offerBackupCreation();
}
