package com.cipherline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Settings under the {@code cipherline} prefix.
 */
@ConfigurationProperties(prefix = "cipherline")
public record CipherlineProperties(
        @DefaultValue Directory directory,
        @DefaultValue Keystore keystore,
        @DefaultValue File file,
        @DefaultValue Backup backup,
        @DefaultValue Lifecycle lifecycle
) {

    public record Directory(
            @DefaultValue("http://localhost:3000/api") String baseUrl,
            @DefaultValue("10s") Duration timeout,
            @DefaultValue("2") int maxRetries,
            @DefaultValue("200ms") Duration retryBackoff
    ) {}

    /**
     * @param type {@code pkcs12} for a password-protected file, {@code memory} for tests and ephemeral sessions
     */
    public record Keystore(
            @DefaultValue("pkcs12") String type,
            @DefaultValue("cipherline-keys.p12") String path,
            @DefaultValue("changeit") String password
    ) {}

    public record File(
            @DefaultValue("512KB") DataSize chunkSize,
            @DefaultValue("5MB") DataSize chunkedThreshold,
            @DefaultValue("true") boolean refreshPeerKey
    ) {}

    public record Backup(
            @DefaultValue("100000") int pbkdf2Iterations,
            @DefaultValue("8") int minPasswordLength
    ) {}

    public record Lifecycle(
            @DefaultValue("2s") Duration legacyRecheckDelay,
            @DefaultValue("3") int maxRestoreAttempts
    ) {}
}
