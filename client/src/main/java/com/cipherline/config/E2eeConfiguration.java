package com.cipherline.config;

import com.cipherline.E2eeService;
import com.cipherline.backup.BackupService;
import com.cipherline.backup.BackupStorage;
import com.cipherline.backup.HttpBackupStorage;
import com.cipherline.directory.AuthorizedHttp;
import com.cipherline.directory.CredentialProvider;
import com.cipherline.directory.HttpKeyDirectoryClient;
import com.cipherline.directory.KeyDirectoryClient;
import com.cipherline.directory.SessionCredentialProvider;
import com.cipherline.file.AttachmentCipher;
import com.cipherline.file.ChunkedFileCipher;
import com.cipherline.keycache.KeyCache;
import com.cipherline.keystore.InMemorySecureKeyStore;
import com.cipherline.keystore.Pkcs12SecureKeyStore;
import com.cipherline.keystore.SecureKeyStore;
import com.cipherline.lifecycle.BackupPrompter;
import com.cipherline.lifecycle.KeyLifecycleManager;
import com.cipherline.lifecycle.NonInteractiveBackupPrompter;
import com.cipherline.message.EnvelopeCodec;
import com.cipherline.message.MessageCipher;
import com.cipherline.notification.MessageKeyClient;
import com.cipherline.notification.NotificationDecryptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

/**
 * Composition root. Every stateful component is a singleton bean built here
 * and handed to its users through constructors.
 */
@Configuration
public class E2eeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(E2eeConfiguration.class);

    // ── Storage ───────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public SecureKeyStore secureKeyStore(CipherlineProperties properties) {
        CipherlineProperties.Keystore keystore = properties.keystore();
        if ("memory".equalsIgnoreCase(keystore.type())) {
            log.info("Using in-memory key store; keys will not survive a restart");
            return new InMemorySecureKeyStore();
        }
        if (!"pkcs12".equalsIgnoreCase(keystore.type())) {
            throw new IllegalStateException("Unknown cipherline.keystore.type: " + keystore.type());
        }
        return new Pkcs12SecureKeyStore(Path.of(keystore.path()), keystore.password().toCharArray());
    }

    @Bean
    public Scheduler cipherlineScheduler() {
        return Schedulers.boundedElastic();
    }

    // ── Directory ─────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public CredentialProvider credentialProvider() {
        return new SessionCredentialProvider();
    }

    @Bean
    public AuthorizedHttp authorizedHttp(WebClient.Builder builder, CredentialProvider credentials,
                                         CipherlineProperties properties) {
        CipherlineProperties.Directory directory = properties.directory();
        return new AuthorizedHttp(builder.baseUrl(directory.baseUrl()).build(), credentials,
                directory.timeout(), directory.maxRetries(), directory.retryBackoff());
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyDirectoryClient keyDirectoryClient(AuthorizedHttp http) {
        return new HttpKeyDirectoryClient(http);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupStorage backupStorage(AuthorizedHttp http) {
        return new HttpBackupStorage(http);
    }

    @Bean
    public MessageKeyClient messageKeyClient(AuthorizedHttp http) {
        return new MessageKeyClient(http);
    }

    // ── Keys ──────────────────────────────────────────────────────────────────

    @Bean
    public KeyCache keyCache(SecureKeyStore store, KeyDirectoryClient directory, Scheduler cipherlineScheduler) {
        return new KeyCache(store, directory, cipherlineScheduler);
    }

    @Bean
    public BackupService backupService(BackupStorage storage, KeyCache keyCache, Scheduler cipherlineScheduler,
                                       CipherlineProperties properties) {
        return new BackupService(storage, keyCache, cipherlineScheduler,
                properties.backup().pbkdf2Iterations(), properties.backup().minPasswordLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackupPrompter backupPrompter() {
        return new NonInteractiveBackupPrompter();
    }

    @Bean
    public KeyLifecycleManager keyLifecycleManager(KeyCache keyCache, BackupService backupService,
                                                   KeyDirectoryClient directory, BackupPrompter prompter,
                                                   CipherlineProperties properties) {
        return new KeyLifecycleManager(keyCache, backupService, directory, prompter,
                properties.lifecycle().legacyRecheckDelay(), properties.lifecycle().maxRestoreAttempts(),
                Schedulers.parallel());
    }

    // ── Ciphers ───────────────────────────────────────────────────────────────

    @Bean
    public MessageCipher messageCipher() {
        return new MessageCipher();
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean
    public ChunkedFileCipher chunkedFileCipher(CipherlineProperties properties, Scheduler cipherlineScheduler) {
        return new ChunkedFileCipher((int) properties.file().chunkSize().toBytes(), cipherlineScheduler);
    }

    @Bean
    public AttachmentCipher attachmentCipher(MessageCipher messageCipher, ChunkedFileCipher chunkedFileCipher,
                                             CipherlineProperties properties, Scheduler cipherlineScheduler) {
        return new AttachmentCipher(messageCipher, chunkedFileCipher,
                properties.file().chunkedThreshold().toBytes(), cipherlineScheduler);
    }

    @Bean
    public NotificationDecryptor notificationDecryptor(MessageKeyClient keyClient, MessageCipher messageCipher,
                                                       ObjectMapper objectMapper) {
        return new NotificationDecryptor(keyClient, messageCipher, objectMapper);
    }

    @Bean
    public E2eeService e2eeService(KeyLifecycleManager lifecycle, KeyCache keyCache, MessageCipher messageCipher,
                                   EnvelopeCodec envelopeCodec, AttachmentCipher attachmentCipher,
                                   CipherlineProperties properties) {
        return new E2eeService(lifecycle, keyCache, messageCipher, envelopeCodec, attachmentCipher,
                properties.file().refreshPeerKey());
    }
}
