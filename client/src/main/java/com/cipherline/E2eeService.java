package com.cipherline;

import com.cipherline.crypto.ConversationKeys;
import com.cipherline.error.TransientNetworkException;
import com.cipherline.file.AttachmentCipher;
import com.cipherline.file.EncryptedAttachment;
import com.cipherline.file.ProgressListener;
import com.cipherline.keycache.KeyCache;
import com.cipherline.lifecycle.KeyLifecycleManager;
import com.cipherline.message.EncryptedEnvelope;
import com.cipherline.message.EnvelopeCodec;
import com.cipherline.message.MessageCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Entry point for encrypting and decrypting user content.
 *
 * <p>Every operation first checks that the device key is ready and fails with
 * {@link com.cipherline.error.EncryptionNotReadyException} otherwise; content
 * is never sent or shown unencrypted as a fallback.
 */
public class E2eeService {

    private static final Logger log = LoggerFactory.getLogger(E2eeService.class);

    private final KeyLifecycleManager lifecycle;
    private final KeyCache keyCache;
    private final MessageCipher messageCipher;
    private final EnvelopeCodec envelopeCodec;
    private final AttachmentCipher attachmentCipher;
    private final boolean refreshPeerKeyForFiles;

    public E2eeService(KeyLifecycleManager lifecycle, KeyCache keyCache, MessageCipher messageCipher,
                       EnvelopeCodec envelopeCodec, AttachmentCipher attachmentCipher,
                       boolean refreshPeerKeyForFiles) {
        this.lifecycle = lifecycle;
        this.keyCache = keyCache;
        this.messageCipher = messageCipher;
        this.envelopeCodec = envelopeCodec;
        this.attachmentCipher = attachmentCipher;
        this.refreshPeerKeyForFiles = refreshPeerKeyForFiles;
    }

    /** @return the envelope JSON to send as the message's encrypted content */
    public Mono<String> encryptMessage(String recipientId, String text) {
        return whenReady(() -> conversationSecret(recipientId, false)
                .map(secret -> envelopeCodec.encode(messageCipher.encrypt(secret, text))));
    }

    public Mono<String> decryptMessage(String senderId, String envelopeJson) {
        return whenReady(() -> {
            EncryptedEnvelope envelope = envelopeCodec.decode(envelopeJson);
            // a message from this sender proves they have published a key since
            keyCache.clearFailedMarker(senderId);
            return messageCipher.decrypt(envelope, () -> conversationSecret(senderId, false))
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
        });
    }

    public Mono<EncryptedAttachment> encryptAttachment(String recipientId, Path file, String fileName,
                                                       ProgressListener listener) {
        return whenReady(() -> conversationSecret(recipientId, false)
                .flatMap(secret -> attachmentCipher.encrypt(file, fileName, secret, listener)));
    }

    public Mono<byte[]> decryptAttachment(String senderId, EncryptedAttachment attachment, ProgressListener listener) {
        return whenReady(() -> {
            keyCache.clearFailedMarker(senderId);
            boolean refresh = attachment.isChunked() && refreshPeerKeyForFiles;
            return conversationSecret(senderId, refresh)
                    .flatMap(secret -> attachmentCipher.decrypt(attachment, secret, listener));
        });
    }

    private Mono<byte[]> conversationSecret(String peerId, boolean refreshPeer) {
        return Mono.zip(keyCache.getOwnKey(), peerKey(peerId, refreshPeer))
                .map(keys -> ConversationKeys.sharedSecret(keys.getT1(), keys.getT2()));
    }

    private Mono<byte[]> peerKey(String peerId, boolean refresh) {
        if (!refresh) {
            return keyCache.getPeerKey(peerId);
        }
        return keyCache.refreshPeerKey(peerId)
                .onErrorResume(TransientNetworkException.class, e -> {
                    log.warn("Could not refresh key for {}, using cached key: {}", peerId, e.getMessage());
                    return keyCache.getPeerKey(peerId);
                });
    }

    private <T> Mono<T> whenReady(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            lifecycle.requireReady();
            return operation.get();
        });
    }
}
