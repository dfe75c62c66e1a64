package com.cipherline.directory;

import com.cipherline.error.NotAuthenticatedException;
import com.cipherline.error.TransientNetworkException;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for calls to the key service: bearer credential, status
 * translation and retry of transient failures.
 *
 * <p>A 404 completes the returned {@code Mono} empty so each caller can map
 * absence to its own error. 401/403 become {@link NotAuthenticatedException},
 * 5xx, I/O errors and timeouts become {@link TransientNetworkException} and are
 * retried with backoff. A missing credential fails at once and is never retried.
 */
public class AuthorizedHttp {

    private final WebClient webClient;
    private final CredentialProvider credentials;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryBackoff;

    public AuthorizedHttp(WebClient webClient, CredentialProvider credentials,
                          Duration timeout, int maxRetries, Duration retryBackoff) {
        this.webClient = webClient;
        this.credentials = credentials;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;
    }

    public <T> Mono<ApiResponse<T>> get(ParameterizedTypeReference<ApiResponse<T>> type,
                                       String uri, Object... uriVariables) {
        return token().flatMap(token -> withResilience(webClient.get()
                .uri(uri, uriVariables)
                .headers(headers -> headers.setBearerAuth(token))
                .retrieve()
                .bodyToMono(type), uri));
    }

    public <T> Mono<ApiResponse<T>> post(Object body, ParameterizedTypeReference<ApiResponse<T>> type,
                                        String uri, Object... uriVariables) {
        return token().flatMap(token -> withResilience(webClient.post()
                .uri(uri, uriVariables)
                .headers(headers -> headers.setBearerAuth(token))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(type), uri));
    }

    private Mono<String> token() {
        return credentials.bearerToken()
                .switchIfEmpty(Mono.error(() -> new NotAuthenticatedException("No bearer credential available")));
    }

    private <T> Mono<T> withResilience(Mono<T> call, String uri) {
        return call
                .timeout(timeout)
                .onErrorResume(WebClientResponseException.class, e -> e.getStatusCode().value() == 404
                        ? Mono.empty()
                        : Mono.error(translate(e.getStatusCode(), uri, e)))
                .onErrorMap(WebClientRequestException.class,
                        e -> new TransientNetworkException("Request to " + uri + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new TransientNetworkException("Request to " + uri + " timed out after " + timeout, e))
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(TransientNetworkException.class::isInstance)
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private static RuntimeException translate(HttpStatusCode status, String uri, Throwable cause) {
        if (status.value() == HttpStatus.UNAUTHORIZED.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
            return new NotAuthenticatedException("Credential rejected by " + uri + " (" + status.value() + ")", cause);
        }
        if (status.is5xxServerError()) {
            return new TransientNetworkException("Server error " + status.value() + " from " + uri, cause);
        }
        return new IllegalStateException("Request to " + uri + " rejected with " + status.value(), cause);
    }
}
