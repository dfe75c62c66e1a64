package com.cipherline.file;

/**
 * One encrypted slice of a file.
 *
 * @param index         zero-based position in the file
 * @param iv            base64 16-byte IV, fresh per chunk
 * @param authTag       hex HMAC-SHA256 over {@code fileId:index:iv:encryptedData}
 * @param encryptedData base64 AES-256-CBC ciphertext
 * @param originalSize  plaintext bytes in this chunk
 * @param encryptedSize length of {@code encryptedData} in base64 characters
 */
public record EncryptedChunk(
        int index,
        String iv,
        String authTag,
        String encryptedData,
        int originalSize,
        int encryptedSize
) {}
