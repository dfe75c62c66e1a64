package com.cipherline.directory;

/**
 * Envelope every directory endpoint answers with:
 * {@code {success, data?, error?}}.
 */
public record ApiResponse<T>(
        boolean success,
        T data,
        String error
) {}
