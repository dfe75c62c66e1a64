package com.cipherline.notification;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.directory.ApiResponse;
import com.cipherline.directory.AuthorizedHttp;
import com.cipherline.error.MissingKeyException;
import org.springframework.core.ParameterizedTypeReference;
import reactor.core.publisher.Mono;

/**
 * {@code GET /messages/{conversationId}/{messageId}/decrypt-key}: the key the
 * server prepared for decrypting one message outside the app.
 */
public class MessageKeyClient {

    private static final ParameterizedTypeReference<ApiResponse<MessageKeyData>> KEY_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final AuthorizedHttp http;

    public MessageKeyClient(AuthorizedHttp http) {
        this.http = http;
    }

    public Mono<byte[]> fetchMessageKey(String conversationId, String messageId) {
        return http.get(KEY_RESPONSE, "/messages/{conversationId}/{messageId}/decrypt-key", conversationId, messageId)
                .switchIfEmpty(Mono.error(() -> new MissingKeyException("No decryption key for message " + messageId)))
                .flatMap(response -> {
                    if (!response.success()) {
                        return Mono.error(new IllegalStateException(
                                response.error() != null ? response.error() : "Failed to get decryption key"));
                    }
                    if (response.data() == null || response.data().key() == null) {
                        return Mono.error(new MissingKeyException("Missing decryption key for message " + messageId));
                    }
                    return Mono.fromCallable(() -> CryptoPrimitives.fromBase64(response.data().key()));
                });
    }

    record MessageKeyData(String key) {}
}
