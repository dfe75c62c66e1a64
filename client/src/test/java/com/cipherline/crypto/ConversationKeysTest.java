package com.cipherline.crypto;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ConversationKeysTest {

    @Test
    void sharedSecretIsSymmetric() {
        DeviceKey alice = DeviceKey.generate();
        DeviceKey bob = DeviceKey.generate();

        byte[] aliceSide = ConversationKeys.sharedSecret(alice, bob.publicKey());
        byte[] bobSide = ConversationKeys.sharedSecret(bob, alice.publicKey());

        assertEquals(32, aliceSide.length);
        assertArrayEquals(aliceSide, bobSide,
                "Sender resolving the recipient and recipient resolving the sender must agree");
    }

    @Test
    void sharedSecretDiffersPerPeer() {
        DeviceKey alice = DeviceKey.generate();
        DeviceKey bob = DeviceKey.generate();
        DeviceKey eve = DeviceKey.generate();

        byte[] aliceBob = ConversationKeys.sharedSecret(alice, bob.publicKey());
        byte[] aliceEve = ConversationKeys.sharedSecret(alice, eve.publicKey());

        assertFalse(Arrays.equals(aliceBob, aliceEve));
    }

    @Test
    void sharedSecretIsNotTheRawAgreement() {
        DeviceKey alice = DeviceKey.generate();
        DeviceKey bob = DeviceKey.generate();

        assertFalse(Arrays.equals(alice.agree(bob.publicKey()), ConversationKeys.sharedSecret(alice, bob.publicKey())),
                "The raw X25519 output must be run through the labelled digest");
    }

    @Test
    void rejectsMalformedPeerKey() {
        DeviceKey alice = DeviceKey.generate();

        assertThrows(IllegalArgumentException.class, () -> ConversationKeys.sharedSecret(alice, new byte[31]));
        assertThrows(IllegalArgumentException.class, () -> ConversationKeys.sharedSecret(alice, null));
    }

    @Test
    void deviceKeyRestoredFromBytesHasSamePublicKey() {
        DeviceKey original = DeviceKey.generate();

        DeviceKey restored = DeviceKey.fromBytes(original.secretBytes());

        assertTrue(original.sameSecretAs(restored));
        assertArrayEquals(original.publicKey(), restored.publicKey());
        assertEquals(original.fingerprint(), restored.fingerprint());
        assertFalse(restored.toString().contains(CryptoPrimitives.toBase64(original.secretBytes())),
                "toString must not leak the secret");
    }

    @Test
    void deviceKeyRejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> DeviceKey.fromBytes(new byte[16]));
    }
}
