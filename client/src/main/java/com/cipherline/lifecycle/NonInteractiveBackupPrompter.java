package com.cipherline.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Used when no UI is attached: restore is never attempted, new users skip
 * backup, and backup offers are only logged.
 */
public class NonInteractiveBackupPrompter implements BackupPrompter {

    private static final Logger log = LoggerFactory.getLogger(NonInteractiveBackupPrompter.class);

    @Override
    public Mono<String> requestRestorePassword(int attempt) {
        log.info("Key backup found but no prompter is attached; restore skipped");
        return Mono.empty();
    }

    @Override
    public Mono<String> requestNewBackupPassword() {
        return Mono.empty();
    }

    @Override
    public void offerBackupCreation() {
        log.info("No key backup exists for this account; create one to recover messages on a new device");
    }
}
