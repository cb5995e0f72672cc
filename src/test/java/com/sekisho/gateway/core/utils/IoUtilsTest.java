package com.sekisho.gateway.core.utils;

import com.sekisho.gateway.core.exceptions.ProtocolException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IoUtilsTest {

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void readLine_splitsOnCrlfAndBareLf() throws Exception {
        InputStream in = stream("GET / HTTP/1.1\r\nHost: a\n\r\n");

        assertThat(IoUtils.readLine(in)).isEqualTo("GET / HTTP/1.1");
        assertThat(IoUtils.readLine(in)).isEqualTo("Host: a");
        assertThat(IoUtils.readLine(in)).isEmpty();
        assertThat(IoUtils.readLine(in)).isNull();
    }

    @Test
    void readLine_unterminatedLastLine_isReturned() throws Exception {
        assertThat(IoUtils.readLine(stream("tail"))).isEqualTo("tail");
    }

    @Test
    void readLine_decodesLatin1() throws Exception {
        byte[] bytes = {'c', 'a', 'f', (byte) 0xE9, '\n'};

        assertThat(IoUtils.readLine(new ByteArrayInputStream(bytes))).isEqualTo("café");
    }

    @Test
    void readLine_tooLong_isHeaderFieldsTooLarge() {
        InputStream in = stream("x".repeat(17) + "\r\n");

        assertThatThrownBy(() -> IoUtils.readLine(in, 16))
                .isInstanceOfSatisfying(ProtocolException.class, e -> assertThat(e.getStatus()).isEqualTo(431));
    }

    @Test
    void readLine_atLimit_isAccepted() throws Exception {
        assertThat(IoUtils.readLine(stream("x".repeat(16) + "\r\n"), 16)).hasSize(16);
    }

    @Test
    void daemonThreadFactory_namesThreadsInOrder() {
        ThreadFactory factory = IoUtils.daemonThreadFactory("upstream");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertThat(first.isDaemon()).isTrue();
        assertThat(first.getName()).isEqualTo("upstream-1");
        assertThat(second.getName()).isEqualTo("upstream-2");
    }

    @Test
    void closeQuietly_ignoresNullAndFailures() {
        IoUtils.closeQuietly(null, "nothing");
        IoUtils.closeQuietly(() -> {
            throw new IllegalStateException("boom");
        }, "failing resource");
    }
}
