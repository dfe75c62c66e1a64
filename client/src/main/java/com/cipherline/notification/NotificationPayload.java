package com.cipherline.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Data section of a push notification for a new message.
 *
 * @param title the title the push service attached, used for group chats
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationPayload(
        String type,
        String conversationId,
        String messageId,
        String senderId,
        String senderName,
        String messageType,
        String conversationType,
        String encryptedContent,
        EncryptionMetadata encryptionMetadata,
        boolean decrypted,
        String title
) {

    /** Sent separately by servers that do not embed the IV in {@code encryptedContent}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EncryptionMetadata(String iv, String authTag) {}

    public boolean isGroup() {
        return "group".equals(conversationType);
    }
}
