package com.sekisho.gateway.core.utils;

import com.sekisho.gateway.core.exceptions.ProtocolException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Socket-level helpers shared by the gateway server, the admin server and the
 * backend client.
 */
public final class IoUtils {
    private static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    /** Longest request line or header line accepted, in bytes. */
    public static final int MAX_LINE_LENGTH = 8192;

    private IoUtils() {
    }

    /**
     * Reads one HTTP line of at most {@link #MAX_LINE_LENGTH} bytes.
     *
     * @see #readLine(InputStream, int)
     */
    public static String readLine(InputStream in) throws IOException {
        return readLine(in, MAX_LINE_LENGTH);
    }

    /**
     * Reads one line terminated by LF or CRLF. Bytes are decoded as ISO-8859-1,
     * the HTTP/1.1 wire encoding; CR characters are dropped.
     *
     * @param in        stream positioned at the start of a line.
     * @param maxLength longest line accepted, in bytes.
     * @return the line without its terminator, or null at end of stream.
     * @throws ProtocolException 431 when the line is longer than {@code maxLength}.
     * @throws IOException       on read failure or timeout.
     */
    public static String readLine(InputStream in, int maxLength) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(128);
        int read = 0;
        int c;
        while ((c = in.read()) != -1 && c != '\n') {
            if (c == '\r') {
                continue;
            }
            if (++read > maxLength) {
                throw new ProtocolException(431, "Line exceeds " + maxLength + " bytes");
            }
            line.write(c);
        }
        if (c == -1 && read == 0) {
            return null;
        }
        return line.toString(StandardCharsets.ISO_8859_1);
    }

    /**
     * Thread factory for daemon threads named {@code prefix-1}, {@code prefix-2}, ...
     *
     * @param prefix pool name.
     * @return the factory.
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Closes a socket or server socket, logging a failure at debug level.
     *
     * @param closeable resource to close; may be null.
     * @param name      what is being closed, for the log.
     */
    public static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Failed to close {}: {}", name, e.getMessage());
        }
    }
}
