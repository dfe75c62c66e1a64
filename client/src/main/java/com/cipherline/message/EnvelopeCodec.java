package com.cipherline.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON text form of {@link EncryptedEnvelope}, as carried in a message's
 * {@code encryptedContent} field.
 */
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(EncryptedEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize envelope", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not an envelope with both fields
     */
    public EncryptedEnvelope decode(String json) {
        EncryptedEnvelope envelope;
        try {
            envelope = objectMapper.readValue(json, EncryptedEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid encrypted content format", e);
        }
        if (envelope == null || envelope.iv() == null || envelope.data() == null) {
            throw new IllegalArgumentException("Invalid encrypted content format");
        }
        return envelope;
    }
}
