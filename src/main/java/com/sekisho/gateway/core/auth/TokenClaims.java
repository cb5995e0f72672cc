package com.sekisho.gateway.core.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Identity and registered claims carried by a gateway token.
 * <p>
 * The user id is stored in the {@code sub} claim, so it doubles as the subject.
 * Unset registered claims are filled in by {@link TokenManager} when signing.
 */
public final class TokenClaims {
    private final String userId;
    private final String username;
    private final String email;
    private final Set<String> roles;
    private final Map<String, MetadataValue> metadata;
    private final String issuer;
    private final Set<String> audience;
    private final Instant expiresAt;
    private final Instant issuedAt;
    private final Instant notBefore;

    private TokenClaims(Builder b) {
        this.userId = b.userId;
        this.username = b.username;
        this.email = b.email;
        this.roles = Collections.unmodifiableSet(new LinkedHashSet<>(b.roles));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.issuer = b.issuer;
        this.audience = Collections.unmodifiableSet(new LinkedHashSet<>(b.audience));
        this.expiresAt = b.expiresAt;
        this.issuedAt = b.issuedAt;
        this.notBefore = b.notBefore;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every claim of this instance.
     */
    public Builder toBuilder() {
        return new Builder()
                .userId(userId)
                .username(username)
                .email(email)
                .roles(roles)
                .metadata(metadata)
                .issuer(issuer)
                .audience(audience)
                .expiresAt(expiresAt)
                .issuedAt(issuedAt)
                .notBefore(notBefore);
    }

    public String getUserId() {
        return userId;
    }

    public String getSubject() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public String getEmail() {
        return email;
    }

    public Set<String> getRoles() {
        return roles;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public Map<String, MetadataValue> getMetadata() {
        return metadata;
    }

    public String getIssuer() {
        return issuer;
    }

    public Set<String> getAudience() {
        return audience;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenClaims other)) {
            return false;
        }
        return Objects.equals(userId, other.userId)
                && Objects.equals(username, other.username)
                && Objects.equals(email, other.email)
                && roles.equals(other.roles)
                && metadata.equals(other.metadata)
                && Objects.equals(issuer, other.issuer)
                && audience.equals(other.audience)
                && Objects.equals(expiresAt, other.expiresAt)
                && Objects.equals(issuedAt, other.issuedAt)
                && Objects.equals(notBefore, other.notBefore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, username, email, roles, metadata, issuer, audience,
                expiresAt, issuedAt, notBefore);
    }

    @Override
    public String toString() {
        return "TokenClaims{sub=" + userId + ", username=" + username + ", roles=" + roles
                + ", iss=" + issuer + ", aud=" + audience + ", exp=" + expiresAt + "}";
    }

    /**
     * Mutable builder for {@link TokenClaims}.
     */
    public static final class Builder {
        private String userId;
        private String username;
        private String email;
        private final Set<String> roles = new LinkedHashSet<>();
        private final Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        private String issuer;
        private final Set<String> audience = new LinkedHashSet<>();
        private Instant expiresAt;
        private Instant issuedAt;
        private Instant notBefore;

        private Builder() {
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder roles(Set<String> roles) {
            this.roles.clear();
            if (roles != null) {
                this.roles.addAll(roles);
            }
            return this;
        }

        public Builder role(String role) {
            this.roles.add(role);
            return this;
        }

        public Builder metadata(Map<String, MetadataValue> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, MetadataValue value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(Set<String> audience) {
            this.audience.clear();
            if (audience != null) {
                this.audience.addAll(audience);
            }
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder issuedAt(Instant issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public TokenClaims build() {
            return new TokenClaims(this);
        }
    }
}
