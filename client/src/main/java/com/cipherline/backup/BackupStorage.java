package com.cipherline.backup;

import reactor.core.publisher.Mono;

/**
 * Server-side home of the single backup blob for the signed-in user.
 */
public interface BackupStorage {

    Mono<Boolean> hasBackup();

    /** Replaces any existing backup. */
    Mono<Void> upload(BackupBlob blob);

    /** Completes empty when the user has no backup. */
    Mono<BackupBlob> download();
}
