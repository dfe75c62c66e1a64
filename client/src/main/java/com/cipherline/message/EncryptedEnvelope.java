package com.cipherline.message;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire form of an encrypted message: base64 IV and base64 ciphertext.
 * Older senders wrote the ciphertext under {@code "ciphertext"}; both names are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EncryptedEnvelope(
        @JsonProperty("iv") String iv,
        @JsonProperty("data") @JsonAlias("ciphertext") String data
) {}
