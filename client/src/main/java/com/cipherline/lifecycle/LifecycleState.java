package com.cipherline.lifecycle;

public enum LifecycleState {
    /** No session, or initialization could not establish a key. */
    UNINITIALIZED,
    /** No local key and no backup: a fresh key is being generated. */
    NEW_USER,
    /** No local key but a backup exists: waiting for the backup password. */
    NEEDS_RESTORE,
    /** Local key without a backup, from an install that predates backups. */
    LEGACY_NO_BACKUP,
    /** Local key and backup both present. */
    READY_NO_PROMPT,
    /** Device key loaded and published; encryption available. */
    READY
}
