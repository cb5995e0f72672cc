package com.sekisho.gateway.config;

import com.sekisho.gateway.core.exceptions.ConfigException;
import com.sekisho.gateway.core.proxy.Target;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String SECRET = "config-loader-test-secret-32-bytes-min";

    @TempDir
    Path tempDir;

    private String write(String yaml) throws IOException {
        Path file = tempDir.resolve("gateway.yml");
        Files.writeString(file, yaml);
        return file.toString();
    }

    private static ConfigLoader loader(Map<String, String> env) {
        return new ConfigLoader(env::get);
    }

    @Test
    void load_fullFile_mapsAllSections() throws IOException {
        String path = write("""
                server:
                  host: 127.0.0.1
                  port: 9000
                  readTimeout: 5000
                cors:
                  allowedOrigins: ['https://app.example.com']
                  maxAge: 60
                jwt:
                  secret: %s
                  issuer: auth
                  audience: gateway
                  expiration: 60000
                proxy:
                  timeout: 1500
                  targets:
                    CRM: http://crm.internal:8081/
                    cbs: https://cbs.internal
                logging:
                  format: '%%h %%r'
                admin:
                  enabled: false
                """.formatted(SECRET));

        GatewayProperties props = loader(Map.of()).load(path);

        assertThat(props.getServer().getHost()).isEqualTo("127.0.0.1");
        assertThat(props.getServer().getPort()).isEqualTo(9000);
        assertThat(props.getServer().getReadTimeout()).isEqualTo(5000);
        assertThat(props.getCors().getAllowedOrigins()).containsExactly("https://app.example.com");
        assertThat(props.getCors().getMaxAge()).isEqualTo(60);
        assertThat(props.getJwt().getIssuer()).isEqualTo("auth");
        assertThat(props.getJwt().getExpiration()).isEqualTo(60000L);
        assertThat(props.getProxy().getTimeout()).isEqualTo(1500);
        assertThat(props.getLogging().getFormat()).isEqualTo("%h %r");
        assertThat(props.getAdmin().isEnabled()).isFalse();
        assertThat(props.targets()).extracting(Target::name).containsExactly("cbs", "crm");
    }

    @Test
    void load_secretFromEnvironment() throws IOException {
        String path = write("""
                jwt:
                  secretEnv: GATEWAY_SECRET
                proxy:
                  targets:
                    crm: http://localhost:8081
                """);

        GatewayProperties props = loader(Map.of("GATEWAY_SECRET", SECRET)).load(path);

        assertThat(props.getJwt().getSecret()).isEqualTo(SECRET);
    }

    @Test
    void load_explicitSecretWinsOverEnvironment() throws IOException {
        String path = write("""
                jwt:
                  secret: %s
                proxy:
                  targets:
                    crm: http://localhost:8081
                """.formatted(SECRET));

        GatewayProperties props = loader(Map.of("JWT_SECRET", SECRET + "-env")).load(path);

        assertThat(props.getJwt().getSecret()).isEqualTo(SECRET);
    }

    @Test
    void load_proxyTargetUrl_switchesToSingleTarget() throws IOException {
        String path = write("""
                jwt:
                  secret: %s
                proxy:
                  targets:
                    crm: http://localhost:8081
                    cbs: http://localhost:8082
                """.formatted(SECRET));

        GatewayProperties props = loader(Map.of(ConfigLoader.PROXY_TARGET_URL_ENV, "http://legacy:9000"))
                .load(path);

        assertThat(props.targets()).singleElement().satisfies(target -> {
            assertThat(target.name()).isEqualTo(ProxyConfig.DEFAULT_TARGET);
            assertThat(target.url()).hasToString("http://legacy:9000");
        });
    }

    @Test
    void load_missingSecret_fails() throws IOException {
        String path = write("""
                proxy:
                  targets:
                    crm: http://localhost:8081
                """);

        assertThatThrownBy(() -> loader(Map.of()).load(path))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("JWT secret is required");
    }

    @Test
    void load_invalidYaml_fails() throws IOException {
        String path = write("invalid yaml content: !!!");

        assertThatThrownBy(() -> loader(Map.of()).load(path)).isInstanceOf(ConfigException.class);
    }

    @Test
    void load_missingFile_fails() {
        assertThatThrownBy(() -> loader(Map.of()).load(tempDir.resolve("absent.yml").toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void load_classpathResource() {
        GatewayProperties props = loader(Map.of("JWT_SECRET", SECRET)).load("application.yml");

        assertThat(props.getServer().getPort()).isEqualTo(8080);
        assertThat(props.targets()).extracting(Target::name).containsExactly("cbs", "crm");
    }
}
