package com.voicerelay.servicebackend.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Mints and verifies short-lived HS256 session tokens.
 * Verification is stateless: a token stays valid until its expiry under the same key.
 */
public class SessionTokenService {
    private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
    static final String SCOPE_CLAIM = "scope";
    static final String SCOPE = "voice-agent";

    private final Key signingKey;
    private final Duration expiration;
    private final Clock clock;

    public SessionTokenService(Key signingKey, Duration expiration, Clock clock) {
        this.signingKey = signingKey;
        this.expiration = expiration;
        this.clock = clock;
    }

    /**
     * Builds a service signing with the given secret.
     *
     * @throws io.jsonwebtoken.security.WeakKeyException if the secret is shorter than 256 bits
     */
    public static SessionTokenService withSecret(String secret, Duration expiration, Clock clock) {
        return new SessionTokenService(
                Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)), expiration, clock);
    }

    /**
     * Builds a service signing with a random key that lives as long as the process.
     */
    public static SessionTokenService withGeneratedSecret(Duration expiration, Clock clock) {
        return new SessionTokenService(Keys.secretKeyFor(SignatureAlgorithm.HS256), expiration, clock);
    }

    public String createToken() {
        Instant now = clock.instant();
        Date issuedAt = Date.from(now);
        Date expiresAt = Date.from(now.plus(expiration));

        return Jwts.builder()
                .claim(SCOPE_CLAIM, SCOPE)
                .setIssuedAt(issuedAt)
                .setExpiration(expiresAt)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return true iff the signature matches this service's key and the token has not expired
     */
    public boolean verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            // tokens minted without an expiry are never accepted
            return claims.getExpiration() != null;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Session token rejected: {}", e.getMessage());
            return false;
        }
    }
}
