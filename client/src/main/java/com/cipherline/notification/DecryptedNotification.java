package com.cipherline.notification;

public record DecryptedNotification(
        String title,
        String body,
        String conversationId,
        String messageId
) {}
