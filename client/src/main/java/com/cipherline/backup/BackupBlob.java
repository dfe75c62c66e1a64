package com.cipherline.backup;

/**
 * Device key wrapped under a password-derived key, as stored server-side.
 * All binary fields are base64. The blob is opaque to the server.
 */
public record BackupBlob(
        String encryptedMasterKey,
        String salt,
        String iv,
        String authTag,
        int keyVersion,
        int iterations,
        String createdAt
) {}
