package com.sekisho.gateway.core.proxy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import com.sekisho.gateway.core.auth.TokenClaims;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.RequestContext;
import com.sekisho.gateway.core.http.RequestFixtures;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

class ServiceProxyTest {

    private WireMockServer backend;
    private HttpClient httpClient;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() {
        backend = new WireMockServer(wireMockConfig().dynamicPort());
        backend.start();
        httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (backend != null) {
            backend.stop();
        }
    }

    private ServiceProxy proxy(String baseUrl, Duration timeout) {
        return new ServiceProxy(new Target("crm", URI.create(baseUrl)), httpClient, timeout, registry);
    }

    private ServiceProxy proxy() {
        return proxy("http://localhost:" + backend.port(), Duration.ofSeconds(5));
    }

    private static RequestContext request(String method, String path, String query, Map<String, String> headers,
            String body) {
        return new RequestContext(method, path, query, RequestFixtures.headers(headers),
                "10.0.0.5", false, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    private static String body(GatewayResponse response) {
        return new String(response.getBody(), StandardCharsets.UTF_8);
    }

    @Test
    void handle_replacesClientForwardingHeaders() {
        backend.stubFor(get(urlEqualTo("/api/x?a=1")).willReturn(aResponse().withStatus(200).withBody("ok")));
        Map<String, String> headers = new HashMap<>();
        headers.put("Host", "gw.example.com");
        headers.put("X-Forwarded-For", "1.2.3.4");
        headers.put("X-Real-IP", "9.9.9.9");
        headers.put("X-Forwarded-Proto", "https");
        headers.put("X-User-Id", "admin");
        headers.put("Authorization", "Bearer abc");
        headers.put("X-Custom", "kept");

        GatewayResponse response = proxy().handle(request("GET", "/api/x", "a=1", headers, null));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(body(response)).isEqualTo("ok");
        backend.verify(getRequestedFor(urlEqualTo("/api/x?a=1"))
                .withHeader("X-Real-IP", equalTo("10.0.0.5"))
                .withHeader("X-Forwarded-For", equalTo("10.0.0.5"))
                .withHeader("X-Forwarded-Proto", equalTo("http"))
                .withHeader("X-Forwarded-Host", equalTo("gw.example.com"))
                .withHeader("Host", equalTo("localhost:" + backend.port()))
                .withHeader("Authorization", equalTo("Bearer abc"))
                .withHeader("X-Custom", equalTo("kept"))
                .withoutHeader("X-User-Id"));
    }

    @Test
    void handle_repeatedHeaders_forwardsEveryValue() {
        backend.stubFor(get(urlEqualTo("/cart")).willReturn(aResponse().withStatus(200)));
        Map<String, List<String>> headers = new HashMap<>();
        headers.put("Cookie", List.of("a=1", "b=2"));
        headers.put("Accept", List.of("text/html", "application/json"));
        RequestContext context = new RequestContext("GET", "/cart", null, headers, "10.0.0.5", false, null);

        proxy().handle(context);

        LoggedRequest received = backend.findAll(getRequestedFor(urlEqualTo("/cart"))).get(0);
        assertThat(received.header("Cookie").values()).containsExactly("a=1", "b=2");
        assertThat(received.header("Accept").values()).containsExactly("text/html", "application/json");
    }

    @Test
    void handle_success_logsMethodPathAndStatus() {
        backend.stubFor(get(urlEqualTo("/api/orders")).willReturn(aResponse().withStatus(202)));
        Logger logger = (Logger) LoggerFactory.getLogger(ServiceProxy.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        logger.addAppender(appender);
        try {
            RequestContext context = request("GET", "/crm/api/orders", null, Map.of(), null);
            context.setForwardPath("/api/orders");

            proxy().handle(context);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(previous);
        }

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(line -> assertThat(line)
                        .startsWith("Received response:")
                        .contains("method=GET", "path=/api/orders", "service=crm", "status=202"));
    }

    @Test
    void handle_authenticatedRequest_relaysUserId() {
        backend.stubFor(get(urlEqualTo("/me")).willReturn(aResponse().withStatus(200)));
        RequestContext context = request("GET", "/me", null, Map.of("X-User-Id", "spoofed"), null);
        context.authenticate(TokenClaims.builder().userId("user-42").build());

        proxy().handle(context);

        backend.verify(getRequestedFor(urlEqualTo("/me")).withHeader("X-User-Id", equalTo("user-42")));
    }

    @Test
    void handle_usesForwardPathUnderBasePath() {
        backend.stubFor(get(urlEqualTo("/base/api/x")).willReturn(aResponse().withStatus(200)));
        RequestContext context = request("GET", "/crm/api/x", null, Map.of(), null);
        context.setForwardPath("/api/x");

        GatewayResponse response = proxy("http://localhost:" + backend.port() + "/base", Duration.ofSeconds(5))
                .handle(context);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(context.getService()).isEqualTo("crm");
    }

    @Test
    void handle_forwardsBodyAndRelaysResponse() {
        backend.stubFor(post(urlEqualTo("/orders")).willReturn(aResponse()
                .withStatus(201)
                .withHeader("X-Backend", "yes")
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\":1}")));

        GatewayResponse response = proxy().handle(request("POST", "/orders", null,
                Map.of("Content-Type", "application/json"), "{\"item\":\"book\"}"));

        assertThat(response.getStatus()).isEqualTo(201);
        assertThat(response.getHeader("X-Backend")).isEqualTo("yes");
        assertThat(response.getHeader("Content-Length")).isNull();
        assertThat(body(response)).isEqualTo("{\"id\":1}");
        backend.verify(postRequestedFor(urlEqualTo("/orders")).withRequestBody(equalTo("{\"item\":\"book\"}")));
    }

    @Test
    void handle_backendErrorStatus_isRelayedUnchanged() {
        backend.stubFor(get(urlEqualTo("/missing")).willReturn(aResponse().withStatus(404).withBody("nope")));

        GatewayResponse response = proxy().handle(request("GET", "/missing", null, Map.of(), null));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response)).isEqualTo("nope");
    }

    @Test
    void handle_slowBackend_returnsGatewayTimeout() {
        backend.stubFor(get(urlEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(2000)));

        GatewayResponse response = proxy("http://localhost:" + backend.port(), Duration.ofMillis(200))
                .handle(request("GET", "/slow", null, Map.of(), null));

        assertThat(response.getStatus()).isEqualTo(504);
        assertThat(body(response)).isEqualTo("{\"error\":\"gateway timeout\"}");
        assertThat(response.getHeader("Content-Type")).isEqualTo("application/json");
        assertThat(registry.get("gateway.upstream.errors").tag("kind", "timeout").counter().count()).isEqualTo(1.0);
    }

    @Test
    void handle_connectionReset_returnsBadGateway() {
        backend.stubFor(get(urlEqualTo("/reset")).willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        GatewayResponse response = proxy().handle(request("GET", "/reset", null, Map.of(), null));

        assertThat(response.getStatus()).isEqualTo(502);
        assertThat(body(response)).isEqualTo("{\"error\":\"bad gateway\"}");
        assertThat(registry.get("gateway.upstream.errors").tag("kind", "bad_gateway").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void handle_unreachableBackend_returnsBadGateway() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }

        GatewayResponse response = proxy("http://localhost:" + closedPort, Duration.ofSeconds(2))
                .handle(request("GET", "/", null, Map.of(), null));

        assertThat(response.getStatus()).isEqualTo(502);
    }

    @Test
    void targetUri_joinsBasePathAndQueries() {
        ServiceProxy withBase = proxy("http://backend:8080/v1/?key=k", Duration.ofSeconds(1));
        RequestContext context = request("GET", "/svc/users", "page=2", Map.of(), null);
        context.setForwardPath("/users");

        assertThat(withBase.targetUri(context)).hasToString("http://backend:8080/v1/users?key=k&page=2");
    }

    @Test
    void targetUri_rootForwardPath_keepsTrailingSlash() {
        RequestContext context = request("GET", "/crm", null, Map.of(), null);
        context.setForwardPath("/");

        assertThat(proxy("http://backend:8080", Duration.ofSeconds(1)).targetUri(context))
                .hasToString("http://backend:8080/");
    }

    @Test
    void handle_success_countsUpstreamRequest() {
        backend.stubFor(get(urlEqualTo("/ok")).willReturn(aResponse().withStatus(200)));

        proxy().handle(request("GET", "/ok", null, Map.of(), null));

        assertThat(registry.get("gateway.upstream.requests").tag("service", "crm").tag("status", "200")
                .counter().count()).isEqualTo(1.0);
    }
}
