package com.streamrelay.streamrelay.service.webhook;

import com.streamrelay.streamrelay.exception.WebhookVerificationException;
import com.streamrelay.streamrelay.util.jwt.LiveKitJwt;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Checks that a webhook body was signed by the media platform: the {@code Authorization} header is
 * a token signed with the shared API secret whose {@code sha256} claim is the digest of the body.
 */
@Component
public class WebhookVerifier {

    static final String DIGEST_CLAIM = "sha256";

    private final LiveKitJwt jwt;

    public WebhookVerifier(LiveKitJwt jwt) {
        this.jwt = jwt;
    }

    /**
     * @throws WebhookVerificationException if the header is missing, the token is invalid or the
     *         digest does not match the body
     */
    public void verify(String body, String authorizationHeader) {
        String token = extractToken(authorizationHeader);
        if (token == null) {
            throw new WebhookVerificationException("Missing webhook authorization token");
        }

        Claims claims;
        try {
            claims = jwt.parseToken(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new WebhookVerificationException("Invalid webhook token: " + e.getMessage(), e);
        }

        String expected = claims.get(DIGEST_CLAIM, String.class);
        if (expected == null || expected.isEmpty()) {
            throw new WebhookVerificationException("Webhook token carries no body digest");
        }
        byte[] actual = sha256(body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(actual, expected.getBytes(StandardCharsets.UTF_8))) {
            throw new WebhookVerificationException("Webhook body digest mismatch");
        }
    }

    public static String sha256(String body) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(body.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String extractToken(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            value = value.substring(7).trim();
        }
        return value.isEmpty() ? null : value;
    }
}
