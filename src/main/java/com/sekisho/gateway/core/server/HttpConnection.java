package com.sekisho.gateway.core.server;

import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.exceptions.ProtocolException;
import com.sekisho.gateway.core.http.GatewayResponse;
import com.sekisho.gateway.core.http.HttpHandler;
import com.sekisho.gateway.core.http.RequestContext;
import com.sekisho.gateway.core.utils.IoUtils;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves HTTP/1.1 requests on one client connection until the client closes
 * it, asks for {@code Connection: close}, goes idle for too long, or the server
 * stops.
 * <p>
 * Request bodies must be sent with {@code Content-Length}; chunked request
 * bodies are refused with 411. Responses are always written with a
 * {@code Content-Length}.
 */
class HttpConnection {
    private static final Logger log = LoggerFactory.getLogger(HttpConnection.class);

    private static final int MAX_HTTP_HEADERS = 100;
    private static final long MAX_BODY_BYTES = 10L * 1024 * 1024;

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"), Map.entry(202, "Accepted"),
            Map.entry(204, "No Content"), Map.entry(301, "Moved Permanently"),
            Map.entry(302, "Found"), Map.entry(304, "Not Modified"),
            Map.entry(400, "Bad Request"), Map.entry(401, "Unauthorized"),
            Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(411, "Length Required"), Map.entry(413, "Payload Too Large"),
            Map.entry(414, "URI Too Long"), Map.entry(429, "Too Many Requests"),
            Map.entry(431, "Request Header Fields Too Large"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"),
            Map.entry(505, "HTTP Version Not Supported"));

    private final Socket socket;
    private final HttpHandler handler;
    private final GatewayServer server;
    private final String remoteAddr;
    private final boolean secure;

    /** True while waiting for the first byte of the next request. */
    private volatile boolean idle = true;

    HttpConnection(Socket socket, HttpHandler handler, GatewayServer server) {
        this.socket = socket;
        this.handler = handler;
        this.server = server;
        this.remoteAddr = socket.getInetAddress().getHostAddress();
        this.secure = socket instanceof SSLSocket;
    }

    /**
     * Request loop; returns when the connection should be closed.
     */
    void run() {
        try {
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());

            while (!server.isStopping() && !socket.isClosed() && processNextRequest(in, out)) {
                // Keep-alive: serve the next request on the same connection
            }
        } catch (SocketTimeoutException e) {
            log.debug("Connection from {} timed out: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection from {} closed: {}", remoteAddr, e.getMessage());
        } finally {
            close();
        }
    }

    void closeIfIdle() {
        if (idle) {
            close();
        }
    }

    void close() {
        IoUtils.closeQuietly(socket, "client socket");
    }

    private boolean processNextRequest(InputStream in, OutputStream out) throws IOException {
        if (!awaitRequest(in)) {
            return false;
        }
        socket.setSoTimeout(server.getReadTimeout());

        RequestContext context;
        boolean keepAlive;
        try {
            String requestLine = readRequestLine(in);
            if (requestLine == null) {
                return false;
            }
            if (requestLine.isEmpty()) {
                // Stray CRLF between requests
                return true;
            }
            String[] parts = requestLine.split(" ");
            if (parts.length != 3) {
                throw new ProtocolException("Malformed request line");
            }
            String method = parts[0];
            String version = parts[2];
            if (!"HTTP/1.1".equals(version) && !"HTTP/1.0".equals(version)) {
                throw new ProtocolException(505, "Unsupported HTTP version: " + version);
            }

            Map<String, List<String>> headers = readHeaders(in);
            URI target = parseTarget(parts[1]);
            byte[] body = readBody(in, headers);
            if (body == null) {
                return false;
            }

            String connection = first(headers, HeaderConstants.CONNECTION.getValue());
            keepAlive = "HTTP/1.1".equals(version)
                    ? !"close".equalsIgnoreCase(connection)
                    : "keep-alive".equalsIgnoreCase(connection);

            context = new RequestContext(method, target.getRawPath(), target.getRawQuery(), headers,
                    remoteAddr, secure, body);
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
            writeResponse(out, GatewayResponse.error(e.getStatus(), errorMessage(e.getStatus())), false, false);
            return false;
        }

        GatewayResponse response = handler.handle(context);
        keepAlive = keepAlive && !server.isStopping();
        writeResponse(out, response, "HEAD".equals(context.getMethod()), keepAlive);
        return keepAlive;
    }

    /**
     * Waits for the first byte of the next request under the idle timeout.
     *
     * @return false if the client closed the connection.
     */
    private boolean awaitRequest(InputStream in) throws IOException {
        idle = true;
        try {
            if (server.isStopping()) {
                return false;
            }
            socket.setSoTimeout(server.getIdleTimeout());
            in.mark(1);
            if (in.read() == -1) {
                return false;
            }
            in.reset();
            return true;
        } finally {
            idle = false;
        }
    }

    private static String readRequestLine(InputStream in) throws IOException {
        try {
            return IoUtils.readLine(in);
        } catch (ProtocolException e) {
            throw new ProtocolException(414, e.getMessage());
        }
    }

    private Map<String, List<String>> readHeaders(InputStream in) throws IOException {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException(431,
                        "Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx <= 0) {
                throw new ProtocolException("Malformed header line");
            }
            headers.computeIfAbsent(line.substring(0, idx).trim(), k -> new ArrayList<>())
                    .add(line.substring(idx + 1).trim());
        }
        return headers;
    }

    private static URI parseTarget(String rawTarget) {
        try {
            URI uri = new URI(rawTarget);
            if (uri.isAbsolute()) {
                // absolute-form: keep path and query only
                String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
                uri = new URI(uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery());
            }
            if (uri.getRawPath() == null || !uri.getRawPath().startsWith("/")) {
                throw new ProtocolException("Request target must be an absolute path: " + rawTarget);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new ProtocolException("Invalid request target: " + e.getMessage());
        }
    }

    /**
     * @return the body, or null if the client closed the connection mid-body.
     */
    private static byte[] readBody(InputStream in, Map<String, List<String>> headers) throws IOException {
        String transferEncoding = first(headers, HeaderConstants.TRANSFER_ENCODING.getValue());
        if (transferEncoding != null && !"identity".equalsIgnoreCase(transferEncoding)) {
            throw new ProtocolException(411, "Chunked request bodies are not supported");
        }
        List<String> lengths = headers.getOrDefault(HeaderConstants.CONTENT_LENGTH.getValue(), List.of());
        if (lengths.isEmpty()) {
            return new byte[0];
        }
        if (lengths.stream().distinct().count() > 1) {
            throw new ProtocolException("Conflicting Content-Length headers");
        }
        String clStr = lengths.get(0);
        long length;
        try {
            length = Long.parseLong(clStr.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
        if (length < 0) {
            throw new ProtocolException("Invalid Content-Length: " + clStr);
        }
        if (length > MAX_BODY_BYTES) {
            throw new ProtocolException(413, "Request body exceeds " + MAX_BODY_BYTES + " bytes");
        }
        byte[] body = in.readNBytes((int) length);
        return body.length == length ? body : null;
    }

    private static String first(Map<String, List<String>> headers, String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private void writeResponse(OutputStream out, GatewayResponse response, boolean head, boolean keepAlive)
            throws IOException {
        int status = response.getStatus();
        boolean bodiless = status < 200 || status == 204 || status == 304;

        StringBuilder sb = new StringBuilder(256);
        sb.append("HTTP/1.1 ").append(status).append(' ')
                .append(REASON_PHRASES.getOrDefault(status, "Unknown")).append("\r\n");
        for (Map.Entry<String, List<String>> header : response.getHeaders().entrySet()) {
            String name = header.getKey();
            if (HeaderConstants.CONNECTION.getValue().equalsIgnoreCase(name)
                    || HeaderConstants.TRANSFER_ENCODING.getValue().equalsIgnoreCase(name)
                    || HeaderConstants.CONTENT_LENGTH.getValue().equalsIgnoreCase(name)) {
                continue;
            }
            for (String value : header.getValue()) {
                sb.append(name).append(": ").append(value).append("\r\n");
            }
        }
        if (!bodiless) {
            String declared = response.getHeader(HeaderConstants.CONTENT_LENGTH.getValue());
            long length = head && declared != null ? parseLength(declared, response.getBody().length)
                    : response.getBody().length;
            sb.append(HeaderConstants.CONTENT_LENGTH.getValue()).append(": ").append(length).append("\r\n");
        }
        if (!keepAlive) {
            sb.append(HeaderConstants.CONNECTION.getValue()).append(": close\r\n");
        }
        sb.append("\r\n");

        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (!bodiless && !head) {
            out.write(response.getBody());
        }
        out.flush();
    }

    private static long parseLength(String value, long fallback) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String errorMessage(int status) {
        return REASON_PHRASES.getOrDefault(status, "Bad Request").toLowerCase(Locale.ROOT);
    }
}
