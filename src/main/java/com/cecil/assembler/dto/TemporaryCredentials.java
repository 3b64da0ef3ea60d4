package com.cecil.assembler.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

/**
 * Short-lived object-store credentials issued for a single data request.
 */
public record TemporaryCredentials(
        @JsonProperty("access_key_id") String accessKeyId,
        @JsonProperty("secret_access_key") String secretAccessKey,
        @JsonProperty("session_token") String sessionToken,
        @JsonProperty("expiration") OffsetDateTime expiration
) {
    @Override
    public String toString() {
        // keep secrets out of logs
        return "TemporaryCredentials[accessKeyId=" + accessKeyId + ", expiration=" + expiration + "]";
    }
}
