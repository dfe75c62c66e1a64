package com.cipherline.message;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.error.MissingKeyException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Symmetric encryption of text messages and small attachments.
 *
 * <p>AES-256 in CTR mode with a fresh 16-byte IV per message. Keys of any
 * other length than 32 bytes are first run through SHA-256. The envelope
 * carries no authentication tag: a modified ciphertext decrypts to garbage
 * rather than failing. Chunked files are authenticated separately.
 */
public class MessageCipher {

    public EncryptedEnvelope encrypt(byte[] key, byte[] plaintext) {
        byte[] iv = CryptoPrimitives.randomBytes(CryptoPrimitives.BLOCK_IV_SIZE);
        byte[] ciphertext = CryptoPrimitives.aesCtr(normalize(key), iv, plaintext);
        return new EncryptedEnvelope(CryptoPrimitives.toBase64(iv), CryptoPrimitives.toBase64(ciphertext));
    }

    public EncryptedEnvelope encrypt(byte[] key, String text) {
        return encrypt(key, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException if the envelope is not valid base64 or the IV has the wrong size
     */
    public byte[] decrypt(byte[] key, EncryptedEnvelope envelope) {
        byte[] iv = CryptoPrimitives.fromBase64(envelope.iv());
        if (iv.length != CryptoPrimitives.BLOCK_IV_SIZE) {
            throw new IllegalArgumentException("Invalid encrypted content format: IV must be 16 bytes");
        }
        byte[] ciphertext = CryptoPrimitives.fromBase64(envelope.data());
        return CryptoPrimitives.aesCtr(normalize(key), iv, ciphertext);
    }

    public String decryptText(byte[] key, EncryptedEnvelope envelope) {
        return new String(decrypt(key, envelope), StandardCharsets.UTF_8);
    }

    /**
     * Validates the envelope, then asks {@code keys} for the key. Malformed
     * input fails without a key lookup.
     */
    public Mono<byte[]> decrypt(EncryptedEnvelope envelope, KeyResolver keys) {
        return Mono.defer(() -> {
            if (envelope == null || envelope.iv() == null || envelope.data() == null) {
                return Mono.error(new IllegalArgumentException("Invalid encrypted content format"));
            }
            byte[] iv;
            byte[] ciphertext;
            try {
                iv = CryptoPrimitives.fromBase64(envelope.iv());
                ciphertext = CryptoPrimitives.fromBase64(envelope.data());
            } catch (IllegalArgumentException e) {
                return Mono.error(new IllegalArgumentException("Invalid encrypted content format", e));
            }
            if (iv.length != CryptoPrimitives.BLOCK_IV_SIZE) {
                return Mono.error(new IllegalArgumentException("Invalid encrypted content format: IV must be 16 bytes"));
            }
            return keys.resolve()
                    .switchIfEmpty(Mono.error(() -> new MissingKeyException("No key available for decryption")))
                    .map(key -> CryptoPrimitives.aesCtr(normalize(key), iv, ciphertext));
        });
    }

    private static byte[] normalize(byte[] key) {
        if (key == null || key.length == 0) {
            throw new MissingKeyException("Encryption key is missing");
        }
        return key.length == CryptoPrimitives.KEY_SIZE ? key : CryptoPrimitives.sha256(key);
    }
}
