package com.cipherline.directory;

/**
 * Body of {@code POST /keys/upload} and the {@code data} of {@code GET /keys/{userId}}.
 * The field keeps its wire name; with X25519 it really is a public key now.
 */
public record PublicKeyData(String publicKey) {}
