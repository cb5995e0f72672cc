package com.sekisho.gateway;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SekishoGatewayApplicationTest {

    @BeforeAll
    static void disableShutdownHook() {
        System.setProperty("sekisho.no-shutdown-hook", "true");
    }

    @AfterAll
    static void restoreShutdownHook() {
        System.clearProperty("sekisho.no-shutdown-hook");
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new SekishoGatewayApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new SekishoGatewayApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void call_withValidConfig_startsGateway() throws Exception {
        Path configFile = Files.createTempFile("sekisho", ".yml");
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }

        String yaml = """
                server:
                  host: 127.0.0.1
                  port: %d
                jwt:
                  secret: application-test-secret-0123456789abcdef
                proxy:
                  targets:
                    crm: http://127.0.0.1:1
                admin:
                  enabled: false
                logging:
                  format: '%%h %%r %%>s'
                """.formatted(port);
        Files.writeString(configFile, yaml);

        System.setProperty("picocli.ansi", "false");
        SekishoGatewayApplication app = new SekishoGatewayApplication();
        CommandLine cmd = new CommandLine(app);
        AtomicInteger exitCode = new AtomicInteger(-1);

        Thread appThread = new Thread(() -> exitCode.set(cmd.execute("-c", configFile.toAbsolutePath().toString())));
        appThread.setDaemon(true);
        appThread.start();

        assertThat(app.awaitStarted(Duration.ofSeconds(10))).isTrue();
        await().atMost(Duration.ofSeconds(10)).until(() -> {
            try (Socket s = new Socket("127.0.0.1", port)) {
                return s.isConnected();
            } catch (IOException e) {
                return false;
            }
        });

        app.stop();

        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
        assertThat(exitCode.get()).isZero();

        Files.deleteIfExists(configFile);
    }

    @Test
    void call_withInvalidConfig_returnsError() throws Exception {
        Path configFile = Files.createTempFile("sekisho-bad", ".yml");
        Files.writeString(configFile, "invalid yaml content: !!!");

        int exitCode = new CommandLine(new SekishoGatewayApplication())
                .execute("-c", configFile.toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
        Files.deleteIfExists(configFile);
    }

    @Test
    void call_withoutTargets_returnsError() throws Exception {
        Path configFile = Files.createTempFile("sekisho-empty", ".yml");
        Files.writeString(configFile, """
                jwt:
                  secret: application-test-secret-0123456789abcdef
                admin:
                  enabled: false
                """);

        int exitCode = new CommandLine(new SekishoGatewayApplication())
                .execute("-c", configFile.toAbsolutePath().toString());

        assertThat(exitCode).isEqualTo(1);
        Files.deleteIfExists(configFile);
    }
}
