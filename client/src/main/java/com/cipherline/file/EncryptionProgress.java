package com.cipherline.file;

/**
 * Snapshot reported to a {@link ProgressListener}.
 */
public record EncryptionProgress(
        Phase phase,
        int currentChunk,
        int totalChunks,
        double percentage,
        long bytesProcessed,
        long totalBytes
) {

    public enum Phase {
        READING,
        ENCRYPTING,
        VERIFYING,
        DECRYPTING,
        FINALIZING
    }
}
