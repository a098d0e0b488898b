package com.agentrooms.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth credential bundle a caller may attach to a chat request.
 * {@link #toString()} masks both tokens so the record can be logged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaudeAuth(
        String accessToken,
        String refreshToken,
        Long expiresAt,
        String userId,
        String subscriptionType,
        Account account
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Account(
            @JsonProperty("email_address") String emailAddress,
            String uuid
    ) {}

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    public static String mask(String token) {
        if (token == null) return null;
        return token.length() <= 10 ? "***" : token.substring(0, 10) + "...";
    }

    @Override
    public String toString() {
        return "ClaudeAuth[accessToken=" + mask(accessToken)
                + ", refreshToken=" + mask(refreshToken)
                + ", expiresAt=" + expiresAt
                + ", userId=" + userId
                + ", subscriptionType=" + subscriptionType + "]";
    }
}
