package com.cipherline.keystore;

/** Storage names used by the subsystem. */
public final class KeyNames {

    public static final String DEVICE_KEY = "e2ee_master_key";
    public static final String PEER_KEY_PREFIX = "encryption_key_";

    private KeyNames() {}

    public static String peerKey(String userId) {
        return PEER_KEY_PREFIX + userId;
    }
}
