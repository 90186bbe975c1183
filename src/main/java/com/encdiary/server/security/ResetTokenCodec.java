package com.encdiary.server.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.encdiary.server.error.TokenInvalidException;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Issues and verifies signed, time-limited tokens carrying a user id.
 * <p>
 * The signing key is HMAC-SHA256(secret, purpose), so tokens minted for one
 * purpose do not verify under another even when the server secret is shared.
 * The purpose is also carried as the audience claim. Tokens are not tracked
 * server side: a token stays redeemable until it ages out.
 */
public class ResetTokenCodec {

    public static final String PASSWORD_RESET_PURPOSE = "password-reset";
    public static final long DEFAULT_MAX_AGE_SECONDS = 1800;

    private final String purpose;
    private final Key signingKey;
    private final Clock clock;

    public ResetTokenCodec(String secret, String purpose, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        this.purpose = purpose;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(deriveKey(secret, purpose));
    }

    public String issue(long userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(Long.toString(userId))
                .setAudience(purpose)
                .setIssuedAt(Date.from(now))
                .setId(UUID.randomUUID().toString())
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Returns the user id embedded in {@code token}.
     *
     * @throws TokenInvalidException if the token is malformed, badly signed,
     *         meant for another purpose, or older than {@code maxAgeSeconds}
     */
    public long verify(String token, long maxAgeSeconds) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Token is empty");
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .requireAudience(purpose)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenInvalidException("Token signature or format is invalid", e);
        }

        Date issuedAt = claims.getIssuedAt();
        if (issuedAt == null) {
            throw new TokenInvalidException("Token carries no issue time");
        }
        long age = Duration.between(issuedAt.toInstant(), clock.instant()).getSeconds();
        if (age < 0) {
            throw new TokenInvalidException("Token issue time is in the future");
        }
        if (age > maxAgeSeconds) {
            throw new TokenInvalidException("Token expired " + (age - maxAgeSeconds) + "s ago");
        }

        try {
            return Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            throw new TokenInvalidException("Token subject is not a user id", e);
        }
    }

    public long verify(String token) {
        return verify(token, DEFAULT_MAX_AGE_SECONDS);
    }

    public String getPurpose() {
        return purpose;
    }

    static byte[] deriveKey(String secret, String purpose) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(purpose.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 is not available", e);
        }
    }
}
