package com.cipherline.file;

import com.cipherline.message.EncryptedEnvelope;

/**
 * An encrypted attachment in one of two forms: a single envelope for small
 * payloads, or a {@link ChunkedFile} above the chunking threshold. Exactly
 * one of {@code envelope} and {@code chunkedFile} is set.
 */
public record EncryptedAttachment(
        String fileName,
        String fileType,
        long originalSize,
        EncryptedEnvelope envelope,
        ChunkedFile chunkedFile
) {

    public EncryptedAttachment {
        if ((envelope == null) == (chunkedFile == null)) {
            throw new IllegalArgumentException("Exactly one of envelope and chunkedFile must be set");
        }
    }

    public static EncryptedAttachment single(String fileName, long originalSize, EncryptedEnvelope envelope) {
        return new EncryptedAttachment(fileName, MimeTypes.forFileName(fileName), originalSize, envelope, null);
    }

    public static EncryptedAttachment chunked(ChunkedFile file) {
        return new EncryptedAttachment(file.fileName(), file.fileType(), file.originalSize(), null, file);
    }

    public boolean isChunked() {
        return chunkedFile != null;
    }
}
