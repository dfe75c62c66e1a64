package com.cipherline.crypto;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.util.Arrays;

/**
 * The 256-bit secret generated once per installation.
 *
 * <p>The raw value is used as an X25519 private scalar. Only the derived
 * public key is ever published; the raw value leaves the device solely inside
 * a password-wrapped backup.
 */
public final class DeviceKey {

    private final byte[] secret;
    private final X25519PrivateKeyParameters privateKey;
    private final X25519PublicKeyParameters publicKey;

    private DeviceKey(byte[] secret) {
        if (secret == null || secret.length != CryptoPrimitives.KEY_SIZE) {
            throw new IllegalArgumentException("Device key must be " + CryptoPrimitives.KEY_SIZE + " bytes");
        }
        this.secret = secret.clone();
        this.privateKey = new X25519PrivateKeyParameters(this.secret, 0);
        this.publicKey = privateKey.generatePublicKey();
    }

    public static DeviceKey generate() {
        return new DeviceKey(CryptoPrimitives.randomBytes(CryptoPrimitives.KEY_SIZE));
    }

    public static DeviceKey fromBytes(byte[] secret) {
        return new DeviceKey(secret);
    }

    /** Raw secret, for secure storage and backup wrapping only. */
    public byte[] secretBytes() {
        return secret.clone();
    }

    public byte[] publicKey() {
        return publicKey.getEncoded();
    }

    public String publicKeyBase64() {
        return CryptoPrimitives.toBase64(publicKey.getEncoded());
    }

    public String fingerprint() {
        return CryptoPrimitives.fingerprint(publicKey.getEncoded());
    }

    /** Raw X25519 agreement with a peer's published key. */
    byte[] agree(byte[] peerPublicKey) {
        if (peerPublicKey == null || peerPublicKey.length != X25519PublicKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Peer key must be " + X25519PublicKeyParameters.KEY_SIZE + " bytes");
        }
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(privateKey);
        byte[] shared = new byte[agreement.getAgreementSize()];
        agreement.calculateAgreement(new X25519PublicKeyParameters(peerPublicKey, 0), shared, 0);
        return shared;
    }

    public boolean sameSecretAs(DeviceKey other) {
        return other != null && Arrays.equals(secret, other.secret);
    }

    @Override
    public String toString() {
        return "DeviceKey[" + fingerprint() + "]";
    }
}
