package com.sekisho.gateway.core.auth;

import com.sekisho.gateway.config.JwtConfig;
import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.exceptions.TokenException;
import com.sekisho.gateway.core.exceptions.TokenException.Kind;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.UnsupportedJwtException;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

/**
 * Issues, validates and refreshes HMAC-signed bearer tokens.
 * <p>
 * Tokens are always signed with HS256. Validation accepts any HMAC algorithm
 * the key is strong enough for and rejects everything else, including unsigned
 * tokens. Instances are immutable and safe for concurrent use.
 */
public class TokenManager {

    /** Minimum secret length in bytes (256 bits for HS256). */
    public static final int MIN_SECRET_BYTES = 32;

    private static final Set<String> HMAC_ALGORITHMS = Set.of("HS256", "HS384", "HS512");

    private static final String USERNAME = "username";
    private static final String EMAIL = "email";
    private static final String ROLES = "roles";
    private static final String METADATA = "metadata";

    private final SecretKey key;
    private final String issuer;
    private final String audience;
    private final Duration expiration;
    private final Clock clock;
    private final JwtParser parser;

    /**
     * Creates a manager from the JWT settings, using the system clock.
     *
     * @param config JWT settings.
     * @throws ConfigException if the secret is missing or too short.
     */
    public TokenManager(JwtConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a manager with an explicit clock.
     *
     * @param config JWT settings.
     * @param clock  time source for issuing and expiry checks.
     * @throws ConfigException if the secret is missing or too short.
     */
    public TokenManager(JwtConfig config, Clock clock) {
        if (config == null) {
            throw new ConfigException("JWT configuration is required");
        }
        String secret = config.getSecret();
        if (secret == null || secret.isEmpty()) {
            throw new ConfigException("JWT secret cannot be empty");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new ConfigException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(secretBytes, "HmacSHA256");
        this.issuer = orDefault(config.getIssuer(), JwtConfig.DEFAULT_ISSUER);
        this.audience = orDefault(config.getAudience(), JwtConfig.DEFAULT_AUDIENCE);
        this.expiration = Duration.ofMillis(
                config.getExpiration() > 0 ? config.getExpiration() : JwtConfig.DEFAULT_EXPIRATION);
        this.clock = clock;
        this.parser = Jwts.parser()
                .keyLocator(new HmacKeyLocator())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Issues a token for the given user.
     *
     * @param userId   subject of the token, must not be empty.
     * @param metadata optional metadata claim; may be null.
     * @return compact signed token.
     */
    public String issue(String userId, Map<String, ?> metadata) {
        if (userId == null || userId.isEmpty()) {
            throw new IllegalArgumentException("user id cannot be empty");
        }
        return issueWithClaims(TokenClaims.builder()
                .userId(userId)
                .metadata(MetadataValue.fromMap(metadata))
                .build());
    }

    /**
     * Issues a token from caller-supplied claims. Unset issuer, audience, expiry,
     * issued-at and not-before claims are filled from the manager's settings.
     *
     * @param claims claims to sign; user id is required.
     * @return compact signed token.
     */
    public String issueWithClaims(TokenClaims claims) {
        if (claims == null) {
            throw new IllegalArgumentException("claims cannot be null");
        }
        if (claims.getUserId() == null || claims.getUserId().isEmpty()) {
            throw new IllegalArgumentException("user id cannot be empty");
        }
        Instant now = clock.instant();
        Instant expiresAt = claims.getExpiresAt() != null ? claims.getExpiresAt() : now.plus(expiration);
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt() : now;
        Instant notBefore = claims.getNotBefore() != null ? claims.getNotBefore() : now;
        Collection<String> aud = claims.getAudience().isEmpty() ? List.of(audience) : claims.getAudience();

        JwtBuilder builder = Jwts.builder()
                .subject(claims.getUserId())
                .issuer(orDefault(claims.getIssuer(), issuer))
                .audience().add(aud).and()
                .expiration(Date.from(expiresAt))
                .issuedAt(Date.from(issuedAt))
                .notBefore(Date.from(notBefore));
        if (hasText(claims.getUsername())) {
            builder.claim(USERNAME, claims.getUsername());
        }
        if (hasText(claims.getEmail())) {
            builder.claim(EMAIL, claims.getEmail());
        }
        if (!claims.getRoles().isEmpty()) {
            builder.claim(ROLES, List.copyOf(claims.getRoles()));
        }
        if (!claims.getMetadata().isEmpty()) {
            Map<String, Object> raw = new LinkedHashMap<>();
            claims.getMetadata().forEach((k, v) -> raw.put(k, v.toObject()));
            builder.claim(METADATA, raw);
        }
        return builder.signWith(key, Jwts.SIG.HS256).compact();
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @param token compact token.
     * @return parsed claims.
     * @throws TokenException classifying the failure.
     */
    public TokenClaims validate(String token) {
        return readClaims(parse(token, false));
    }

    /**
     * Re-issues a token with the same identity claims and a fresh lifetime.
     * Expired tokens are accepted as long as they are correctly signed and
     * carry the expected issuer and audience.
     *
     * @param token compact token, possibly expired.
     * @return new compact token.
     * @throws TokenException if the token is not refreshable.
     */
    public String refresh(String token) {
        TokenClaims renewed = readClaims(parse(token, true)).toBuilder()
                .expiresAt(null)
                .issuedAt(null)
                .notBefore(null)
                .build();
        return issueWithClaims(renewed);
    }

    /**
     * Best-effort subject lookup for audit logging. The signature is checked,
     * expiry and claim checks are skipped.
     *
     * @param token compact token.
     * @return the subject, or an empty string if the token cannot be read.
     */
    public String extractUserId(String token) {
        try {
            String subject = parse(token, true).getSubject();
            return subject == null ? "" : subject;
        } catch (TokenException | JwtException e) {
            return "";
        }
    }

    public String getIssuer() {
        return issuer;
    }

    public String getAudience() {
        return audience;
    }

    public Duration getExpiration() {
        return expiration;
    }

    private Claims parse(String token, boolean allowExpired) {
        if (token == null || token.isBlank()) {
            throw new TokenException(Kind.INVALID_TOKEN, "token is empty");
        }
        try {
            return parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            if (allowExpired) {
                return e.getClaims();
            }
            throw new TokenException(Kind.EXPIRED, "token has expired", e);
        } catch (UnsupportedJwtException e) {
            throw new TokenException(Kind.INVALID_SIGNING_METHOD, "invalid signing method", e);
        } catch (JwtException | IllegalArgumentException e) {
            if (isSigningMethodFailure(e)) {
                throw new TokenException(Kind.INVALID_SIGNING_METHOD, "invalid signing method", e);
            }
            throw new TokenException(Kind.INVALID_TOKEN, "invalid token", e);
        }
    }

    private static boolean isSigningMethodFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SigningMethodException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks issuer, audience and subject, then converts the payload. A claim of
     * the wrong JSON type (a numeric {@code username}, say) is an invalid claim.
     */
    private TokenClaims readClaims(Claims claims) {
        try {
            checkClaims(claims);
            return toTokenClaims(claims);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenException(Kind.INVALID_CLAIMS, "invalid claims", e);
        }
    }

    private void checkClaims(Claims claims) {
        if (!issuer.equals(claims.getIssuer())) {
            throw new TokenException(Kind.INVALID_CLAIMS, "invalid issuer");
        }
        Set<String> aud = claims.getAudience();
        if (aud == null || !aud.contains(audience)) {
            throw new TokenException(Kind.INVALID_CLAIMS, "invalid audience");
        }
        if (!hasText(claims.getSubject())) {
            throw new TokenException(Kind.INVALID_CLAIMS, "missing subject");
        }
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        TokenClaims.Builder builder = TokenClaims.builder()
                .userId(claims.getSubject())
                .username(claims.get(USERNAME, String.class))
                .email(claims.get(EMAIL, String.class))
                .issuer(claims.getIssuer())
                .audience(claims.getAudience())
                .expiresAt(toInstant(claims.getExpiration()))
                .issuedAt(toInstant(claims.getIssuedAt()))
                .notBefore(toInstant(claims.getNotBefore()));

        if (claims.get(ROLES) instanceof Collection<?> roles) {
            Set<String> names = new LinkedHashSet<>();
            for (Object role : roles) {
                names.add(String.valueOf(role));
            }
            builder.roles(names);
        }
        if (claims.get(METADATA) instanceof Map<?, ?> metadata) {
            try {
                for (Map.Entry<?, ?> entry : metadata.entrySet()) {
                    if (entry.getValue() != null) {
                        builder.metadata(String.valueOf(entry.getKey()), MetadataValue.fromObject(entry.getValue()));
                    }
                }
            } catch (IllegalArgumentException e) {
                throw new TokenException(Kind.INVALID_CLAIMS, "invalid metadata claim", e);
            }
        }
        return builder.build();
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    /**
     * Hands out the signing key only for HMAC algorithms.
     */
    private final class HmacKeyLocator extends LocatorAdapter<Key> {
        @Override
        protected Key locate(JwsHeader header) {
            String alg = header.getAlgorithm();
            if (alg == null || !HMAC_ALGORITHMS.contains(alg)) {
                throw new SigningMethodException("unexpected signing method: " + alg);
            }
            return key;
        }
    }

    /**
     * Raised by the key locator for non-HMAC algorithms.
     */
    private static final class SigningMethodException extends JwtException {
        SigningMethodException(String message) {
            super(message);
        }
    }
}
