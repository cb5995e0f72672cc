package com.sekisho.gateway.core.http.filters;

import com.sekisho.gateway.config.JwtConfig;
import com.sekisho.gateway.core.auth.BearerAuthenticator;
import com.sekisho.gateway.core.auth.TokenClaims;
import com.sekisho.gateway.core.auth.TokenManager;
import com.sekisho.gateway.core.exceptions.AuthException;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.RequestContext;
import com.sekisho.gateway.core.http.RequestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuthFilterTest {

    private TokenManager tokenManager;
    private AuthFilter filter;

    @BeforeEach
    void setUp() {
        JwtConfig config = new JwtConfig();
        config.setSecret("auth-filter-test-secret-long-enough-for-hs256");
        tokenManager = new TokenManager(config);
        filter = new AuthFilter(new BearerAuthenticator(tokenManager));
    }

    private static RequestContext request(Map<String, String> headers) {
        return new RequestContext("GET", "/crm/api", null, RequestFixtures.headers(headers),
                "127.0.0.1", false, null);
    }

    @Test
    void preHandle_validToken_authenticatesContext() {
        String token = tokenManager.issueWithClaims(TokenClaims.builder().userId("user-1").role("admin").build());
        RequestContext context = request(Map.of("Authorization", "Bearer " + token));

        assertThat(filter.preHandle(context)).isNull();
        assertThat(context.getUserId()).isEqualTo("user-1");
        assertThat(context.getClaims().getRoles()).containsExactly("admin");
    }

    @Test
    void preHandle_missingHeader_isUnauthorized() {
        RequestContext context = request(Map.of());

        GatewayResponse response = filter.preHandle(context);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(new String(response.getBody(), StandardCharsets.UTF_8))
                .isEqualTo("{\"error\":\"missing authorization header\"}");
        assertThat(response.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(context.getUserId()).isNull();
    }

    @Test
    void preHandle_invalidToken_isUnauthorized() {
        GatewayResponse response = filter.preHandle(request(Map.of("Authorization", "Bearer not-a-token")));

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(new String(response.getBody(), StandardCharsets.UTF_8))
                .isEqualTo("{\"error\":\"invalid or expired token\"}");
    }

    @Test
    void preHandle_forbiddenFailure_keepsStatus() {
        BearerAuthenticator authenticator = Mockito.mock(BearerAuthenticator.class);
        Mockito.when(authenticator.authenticate(Mockito.anyString()))
                .thenThrow(AuthException.forbidden("insufficient permissions"));
        Mockito.when(authenticator.getTokenManager()).thenReturn(tokenManager);

        GatewayResponse response = new AuthFilter(authenticator)
                .preHandle(request(Map.of("Authorization", "Bearer x")));

        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void failing_answersInternalError() {
        GatewayResponse response = AuthFilter.failing().preHandle(request(Map.of()));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(new String(response.getBody(), StandardCharsets.UTF_8))
                .isEqualTo("{\"error\":\"internal server error\"}");
    }
}
