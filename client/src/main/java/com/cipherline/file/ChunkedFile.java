package com.cipherline.file;

import java.util.List;

/**
 * A large file encrypted as independently authenticated chunks plus a master
 * tag that binds their order and count.
 *
 * <p>{@code masterIv} is generated but not used by any operation; it is kept
 * so the format stays stable for readers that expect it.
 */
public record ChunkedFile(
        String fileId,
        String fileName,
        String fileType,
        int totalChunks,
        long originalSize,
        long encryptedSize,
        String masterIv,
        String masterAuthTag,
        List<EncryptedChunk> chunks
) {

    public ChunkedFile {
        chunks = List.copyOf(chunks);
    }
}
