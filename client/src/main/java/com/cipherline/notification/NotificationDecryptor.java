package com.cipherline.notification;

import com.cipherline.message.EncryptedEnvelope;
import com.cipherline.message.MessageCipher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Turns an encrypted message notification into a readable title and preview.
 * On failure the caller should show the notification it already has.
 */
public class NotificationDecryptor {

    private static final Logger log = LoggerFactory.getLogger(NotificationDecryptor.class);

    static final int PREVIEW_LENGTH = 100;
    static final String GROUP_TITLE = "Group Chat";

    private final MessageKeyClient keyClient;
    private final MessageCipher messageCipher;
    private final ObjectMapper objectMapper;

    public NotificationDecryptor(MessageKeyClient keyClient, MessageCipher messageCipher, ObjectMapper objectMapper) {
        this.keyClient = keyClient;
        this.messageCipher = messageCipher;
        this.objectMapper = objectMapper;
    }

    public boolean needsDecryption(NotificationPayload payload) {
        return payload != null
                && "message".equals(payload.type())
                && "text".equals(payload.messageType())
                && payload.encryptedContent() != null
                && !payload.encryptedContent().isEmpty()
                && !payload.decrypted();
    }

    public Mono<DecryptedNotification> decrypt(NotificationPayload payload) {
        return Mono.defer(() -> {
            if (!needsDecryption(payload)) {
                return Mono.error(new IllegalArgumentException("Notification does not carry an encrypted text message"));
            }
            EncryptedEnvelope envelope = envelopeOf(payload);
            return messageCipher.decrypt(envelope,
                            () -> keyClient.fetchMessageKey(payload.conversationId(), payload.messageId()))
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                    .map(text -> new DecryptedNotification(titleOf(payload), preview(text),
                            payload.conversationId(), payload.messageId()))
                    .doOnNext(n -> log.debug("Decrypted notification for message {}", payload.messageId()))
                    .doOnError(e -> log.warn("Could not decrypt notification for message {}: {}",
                            payload.messageId(), e.getMessage()));
        });
    }

    /**
     * The content is either a JSON envelope or bare ciphertext with the IV in
     * {@code encryptionMetadata}.
     */
    EncryptedEnvelope envelopeOf(NotificationPayload payload) {
        String content = payload.encryptedContent();
        String metadataIv = payload.encryptionMetadata() != null ? payload.encryptionMetadata().iv() : null;
        JsonNode node = null;
        try {
            node = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.debug("Notification content is not JSON; treating it as raw ciphertext");
        }
        String iv;
        String data;
        if (node != null && node.isObject()) {
            iv = firstText(node, "iv");
            if (iv == null) {
                iv = metadataIv;
            }
            data = firstText(node, "data", "ciphertext", "encrypted", "encryptedContent");
        } else {
            iv = metadataIv;
            data = content;
        }
        if (iv == null || iv.isEmpty()) {
            throw new IllegalArgumentException("Missing IV");
        }
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Missing encrypted data");
        }
        return new EncryptedEnvelope(iv, data);
    }

    static String titleOf(NotificationPayload payload) {
        if (payload.isGroup()) {
            return payload.title() != null && !payload.title().isEmpty() ? payload.title() : GROUP_TITLE;
        }
        return payload.senderName();
    }

    static String preview(String text) {
        if (text.length() <= PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}
