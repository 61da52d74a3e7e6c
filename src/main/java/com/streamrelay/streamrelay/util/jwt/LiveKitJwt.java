package com.streamrelay.streamrelay.util.jwt;

import com.streamrelay.streamrelay.config.LiveKitProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HS256 tokens shared with the media platform: short-lived access tokens for its server API and
 * verification of the tokens it attaches to webhooks. Both are keyed by {@code livekit.api-secret}.
 */
@Component
public class LiveKitJwt {

    private final LiveKitProperties properties;
    private final Clock clock;

    @Autowired
    public LiveKitJwt(LiveKitProperties properties) {
        this(properties, Clock.systemUTC());
    }

    LiveKitJwt(LiveKitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param videoGrant platform permissions, e.g. {@code roomAdmin} and {@code room}
     */
    public String generateApiToken(Map<String, Object> videoGrant) {
        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(properties.getApiKey())
                .subject(properties.getApiKey())
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(now.plusSeconds(properties.getTokenTtlSeconds())))
                .claim("video", new LinkedHashMap<>(videoGrant))
                .signWith(signingKey(), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Join token for a subscribe-only participant of {@code room}.
     */
    public String generateViewerToken(String identity, String room) {
        Map<String, Object> grant = new LinkedHashMap<>();
        grant.put("room", room);
        grant.put("roomJoin", true);
        grant.put("canPublish", false);
        grant.put("canSubscribe", true);

        Instant now = clock.instant();
        return Jwts.builder()
                .issuer(properties.getApiKey())
                .subject(identity)
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(now.plusSeconds(properties.getViewerTokenTtlSeconds())))
                .claim("video", grant)
                .signWith(signingKey(), Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verifies signature, expiry and, when an API key is configured, the issuer.
     *
     * @throws JwtException if the token is not valid
     */
    public Claims parseToken(String token) {
        JwtParserBuilder parser = Jwts.parser()
                .verifyWith(signingKey())
                .clock(() -> Date.from(clock.instant()));
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            parser.requireIssuer(apiKey);
        }
        return parser.build().parseSignedClaims(token).getPayload();
    }

    /**
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is shorter than 256 bits
     */
    private SecretKey signingKey() {
        String secret = properties.getApiSecret() == null ? "" : properties.getApiSecret();
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
