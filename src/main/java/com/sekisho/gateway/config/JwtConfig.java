package com.sekisho.gateway.config;

/**
 * Bearer token settings shared by issuing and validation.
 */
public class JwtConfig {
    public static final String DEFAULT_ISSUER = "api-gateway";
    public static final String DEFAULT_AUDIENCE = "api-gateway";
    public static final long DEFAULT_EXPIRATION = 24L * 60 * 60 * 1000;

    /** HMAC signing secret. At least 32 bytes. */
    private String secret;

    /**
     * Name of an environment variable holding the secret, consulted when
     * {@code secret} is blank.
     */
    private String secretEnv = "JWT_SECRET";

    private String issuer = DEFAULT_ISSUER;

    private String audience = DEFAULT_AUDIENCE;

    /** Token lifetime in milliseconds. Default is 24h. */
    private long expiration = DEFAULT_EXPIRATION;

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getSecretEnv() {
        return secretEnv;
    }

    public void setSecretEnv(String secretEnv) {
        this.secretEnv = secretEnv;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public long getExpiration() {
        return expiration;
    }

    public void setExpiration(long expiration) {
        this.expiration = expiration;
    }
}
