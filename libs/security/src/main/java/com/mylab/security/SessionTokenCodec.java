package com.mylab.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Encodes and decodes {@link SessionClaims} carried in the bearer token as Base64 URL-safe JSON.
 * <p>
 * Signature verification happens at the gateway in front of the service.
 */
public final class SessionTokenCodec {

    private static final Pattern BEARER = Pattern.compile("^\\s*bearer\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SessionTokenCodec() {
        // utility class
    }

    /**
     * Serializes claims to a token string.
     *
     * @throws SessionTokenException if serialization fails
     */
    public static String encode(SessionClaims claims) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(claims);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new SessionTokenException("Failed to encode session token", e);
        }
    }

    /**
     * Parses a token string back to claims.
     *
     * @throws SessionTokenException if the token is not valid Base64 JSON
     */
    public static SessionClaims decode(String token) {
        if (token == null || token.isBlank()) {
            throw new SessionTokenException("Session token is empty", null);
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.strip().getBytes(StandardCharsets.US_ASCII));
            return MAPPER.readValue(json, SessionClaims.class);
        } catch (IllegalArgumentException | java.io.IOException e) {
            throw new SessionTokenException("Failed to decode session token", e);
        }
    }

    /**
     * Returns the session token of an {@code Authorization: Bearer <token>} header value.
     * Other schemes, blank values and tokens containing whitespace yield empty.
     */
    public static Optional<String> fromAuthorizationHeader(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Thrown when a session token cannot be encoded or decoded.
     */
    public static class SessionTokenException extends RuntimeException {
        public SessionTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
