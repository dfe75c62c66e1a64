package com.cipherline.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Pairwise secret between this device and a peer.
 *
 * <p>secret(A, B) = SHA-256(label || X25519(a, B)) = SHA-256(label || X25519(b, A)),
 * so the sender resolves the recipient's key, the recipient resolves the
 * sender's key, and both arrive at the same value.
 */
public final class ConversationKeys {

    private static final byte[] LABEL = "cipherline-conversation-v1".getBytes(StandardCharsets.UTF_8);

    private ConversationKeys() {}

    public static byte[] sharedSecret(DeviceKey own, byte[] peerPublicKey) {
        byte[] agreed = own.agree(peerPublicKey);
        try {
            return CryptoPrimitives.sha256(LABEL, agreed);
        } finally {
            Arrays.fill(agreed, (byte) 0);
        }
    }
}
