package com.cipherline.directory;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.error.PeerKeyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import reactor.core.publisher.Mono;

/**
 * {@code POST /keys/upload} and {@code GET /keys/{userId}}.
 */
public class HttpKeyDirectoryClient implements KeyDirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpKeyDirectoryClient.class);

    private static final ParameterizedTypeReference<ApiResponse<Object>> UPLOAD_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiResponse<PublicKeyData>> KEY_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final AuthorizedHttp http;

    public HttpKeyDirectoryClient(AuthorizedHttp http) {
        this.http = http;
    }

    @Override
    public Mono<Void> publish(byte[] publicKey) {
        String encoded = CryptoPrimitives.toBase64(publicKey);
        return http.post(new PublicKeyData(encoded), UPLOAD_RESPONSE, "/keys/upload")
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Key upload endpoint not found")))
                .flatMap(response -> {
                    if (!response.success()) {
                        String reason = response.error() != null ? response.error() : "Failed to upload key";
                        return Mono.error(new IllegalStateException(reason));
                    }
                    log.info("Published device key {}", CryptoPrimitives.fingerprint(publicKey));
                    return Mono.<Void>empty();
                });
    }

    @Override
    public Mono<byte[]> fetch(String userId) {
        return http.get(KEY_RESPONSE, "/keys/{userId}", userId)
                .switchIfEmpty(Mono.error(() -> new PeerKeyNotFoundException(userId)))
                .flatMap(response -> {
                    if (!response.success() || response.data() == null || response.data().publicKey() == null) {
                        return Mono.error(new PeerKeyNotFoundException(userId,
                                "Invalid key response for user: " + userId));
                    }
                    try {
                        return Mono.just(CryptoPrimitives.fromBase64(response.data().publicKey()));
                    } catch (IllegalArgumentException e) {
                        return Mono.error(new PeerKeyNotFoundException(userId,
                                "Malformed key published by user: " + userId));
                    }
                });
    }
}
