package com.cipherline.file;

import com.cipherline.file.EncryptionProgress.Phase;
import com.cipherline.message.EncryptedEnvelope;
import com.cipherline.message.MessageCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picks the encryption path for an attachment by size: the message cipher at
 * or below the threshold, the chunked file cipher above it.
 */
public class AttachmentCipher {

    private static final Logger log = LoggerFactory.getLogger(AttachmentCipher.class);

    private final MessageCipher messageCipher;
    private final ChunkedFileCipher chunkedFileCipher;
    private final long chunkedThreshold;
    private final Scheduler scheduler;

    public AttachmentCipher(MessageCipher messageCipher, ChunkedFileCipher chunkedFileCipher,
                            long chunkedThreshold, Scheduler scheduler) {
        this.messageCipher = messageCipher;
        this.chunkedFileCipher = chunkedFileCipher;
        this.chunkedThreshold = chunkedThreshold;
        this.scheduler = scheduler;
    }

    public boolean shouldUseChunked(long size) {
        return size > chunkedThreshold;
    }

    public Mono<EncryptedAttachment> encrypt(Path file, String fileName, byte[] key, ProgressListener listener) {
        return Mono.fromCallable(() -> Files.size(file))
                .subscribeOn(scheduler)
                .flatMap(size -> {
                    if (shouldUseChunked(size)) {
                        log.debug("{} is {} bytes; using chunked encryption", fileName, size);
                        return chunkedFileCipher.encrypt(file, fileName, key, listener).map(EncryptedAttachment::chunked);
                    }
                    return Mono.fromCallable(() -> Files.readAllBytes(file))
                            .subscribeOn(scheduler)
                            .map(bytes -> sealSingle(bytes, fileName, key, listener));
                });
    }

    public Mono<EncryptedAttachment> encrypt(byte[] data, String fileName, byte[] key, ProgressListener listener) {
        if (shouldUseChunked(data.length)) {
            return chunkedFileCipher.encrypt(data, fileName, key, listener).map(EncryptedAttachment::chunked);
        }
        return Mono.fromCallable(() -> sealSingle(data, fileName, key, listener)).subscribeOn(scheduler);
    }

    public Mono<byte[]> decrypt(EncryptedAttachment attachment, byte[] key, ProgressListener listener) {
        if (attachment.isChunked()) {
            return chunkedFileCipher.decrypt(attachment.chunkedFile(), key, listener);
        }
        return Mono.fromCallable(() -> {
            long size = attachment.originalSize();
            listener.onProgress(new EncryptionProgress(Phase.DECRYPTING, 0, 1, 0, 0, size));
            byte[] plaintext = messageCipher.decrypt(key, attachment.envelope());
            listener.onProgress(new EncryptionProgress(Phase.FINALIZING, 1, 1, 100, size, size));
            return plaintext;
        }).subscribeOn(scheduler);
    }

    private EncryptedAttachment sealSingle(byte[] data, String fileName, byte[] key, ProgressListener listener) {
        listener.onProgress(new EncryptionProgress(Phase.READING, 0, 1, 0, 0, data.length));
        EncryptedEnvelope envelope = messageCipher.encrypt(key, data);
        listener.onProgress(new EncryptionProgress(Phase.FINALIZING, 1, 1, 100, data.length, data.length));
        return EncryptedAttachment.single(fileName, data.length, envelope);
    }
}
