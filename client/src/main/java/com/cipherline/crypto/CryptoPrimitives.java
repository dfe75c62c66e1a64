package com.cipherline.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Symmetric building blocks shared by the message, file and backup ciphers.
 *
 * <p>Every call creates its own {@link Cipher} / {@link Mac} instance, so the
 * methods are safe to use from concurrent Reactor workers.
 */
public final class CryptoPrimitives {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final String PROVIDER = BouncyCastleProvider.PROVIDER_NAME;

    public static final int KEY_SIZE = 32;
    public static final int BLOCK_IV_SIZE = 16;
    public static final int GCM_IV_SIZE = 12;
    public static final int GCM_TAG_BITS = 128;

    private static final String AES_CTR = "AES/CTR/NoPadding";
    private static final String AES_CBC = "AES/CBC/PKCS7Padding";
    private static final String AES_GCM = "AES/GCM/NoPadding";
    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String PBKDF2 = "PBKDF2WithHmacSHA256";

    private static final SecureRandom RNG = new SecureRandom();

    private CryptoPrimitives() {}

    public static byte[] randomBytes(int length) {
        byte[] out = new byte[length];
        RNG.nextBytes(out);
        return out;
    }

    // ── Digests ───────────────────────────────────────────────────────────────

    public static byte[] sha256(byte[]... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (byte[] part : parts) {
                digest.update(part);
            }
            return digest.digest();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public static byte[] hmacSha256(byte[] key, String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key, HMAC_SHA256));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /** Constant-time comparison of two hex/base64 tags. */
    public static boolean tagsEqual(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                actual.getBytes(StandardCharsets.US_ASCII));
    }

    // ── Symmetric: AES-256 ────────────────────────────────────────────────────

    /**
     * AES-256-CTR keystream XOR. Unauthenticated: a flipped ciphertext bit
     * flips the same plaintext bit and nothing reports it.
     */
    public static byte[] aesCtr(byte[] key, byte[] iv, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(AES_CTR, PROVIDER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-CTR failed", e);
        }
    }

    public static byte[] aesCbcEncrypt(byte[] key, byte[] iv, byte[] plaintext) {
        try {
            Cipher cipher = Cipher.getInstance(AES_CBC, PROVIDER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            return cipher.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-CBC encryption failed", e);
        }
    }

    public static byte[] aesCbcDecrypt(byte[] key, byte[] iv, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(AES_CBC, PROVIDER);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
        return cipher.doFinal(ciphertext);
    }

    /**
     * AES-256-GCM with the 128-bit tag split off the ciphertext, so both can
     * be stored as separate fields.
     *
     * @return {@code [ciphertext, tag]}
     */
    public static byte[][] aesGcmEncrypt(byte[] key, byte[] iv, byte[] plaintext) {
        try {
            Cipher cipher = Cipher.getInstance(AES_GCM, PROVIDER);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext);
            int tagLength = GCM_TAG_BITS / 8;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - tagLength);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - tagLength, sealed.length);
            return new byte[][] {ciphertext, tag};
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * @throws AEADBadTagException when the key is wrong or the data was altered
     */
    public static byte[] aesGcmDecrypt(byte[] key, byte[] iv, byte[] ciphertext, byte[] tag)
            throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(AES_GCM, PROVIDER);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(GCM_TAG_BITS, iv));
        byte[] sealed = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
        return cipher.doFinal(sealed);
    }

    // ── Password KDF ──────────────────────────────────────────────────────────

    public static byte[] pbkdf2Sha256(String password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, KEY_SIZE * 8);
        try {
            return SecretKeyFactory.getInstance(PBKDF2).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }

    // ── Encoding ──────────────────────────────────────────────────────────────

    public static String toBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    public static byte[] fromBase64(String base64) {
        return Base64.getDecoder().decode(base64);
    }

    public static String toHex(byte[] bytes) {
        return HexFormat.of().formatHex(bytes);
    }

    /** First 8 hex chars of SHA-256, safe to log in place of key material. */
    public static String fingerprint(byte[] publicMaterial) {
        return toHex(sha256(publicMaterial)).substring(0, 8);
    }
}
