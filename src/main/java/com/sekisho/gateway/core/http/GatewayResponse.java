package com.sekisho.gateway.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sekisho.gateway.core.constants.HeaderConstants;
import com.sekisho.gateway.core.exceptions.GatewayException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A fully buffered HTTP response, either relayed from a backend or produced by
 * the gateway itself. Headers are case-insensitive and may be amended by
 * filters on the way out.
 */
public class GatewayResponse {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String JSON = "application/json";
    private static final String TEXT = "text/plain; charset=utf-8";

    private final int status;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final byte[] body;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public GatewayResponse(int status, byte[] body) {
        this.status = status;
        this.body = body == null ? new byte[0] : body;
    }

    /**
     * Error response with a JSON body of the form {@code {"error":"..."}}.
     *
     * @param status  HTTP status.
     * @param message human-readable message.
     * @return the response.
     */
    public static GatewayResponse error(int status, String message) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(Map.of("error", message));
            return new GatewayResponse(status, json)
                    .setHeader(HeaderConstants.CONTENT_TYPE.getValue(), JSON);
        } catch (JsonProcessingException e) {
            throw new GatewayException("Failed to encode error body", e);
        }
    }

    public static GatewayResponse text(int status, String text) {
        return new GatewayResponse(status, text.getBytes(StandardCharsets.UTF_8))
                .setHeader(HeaderConstants.CONTENT_TYPE.getValue(), TEXT);
    }

    public static GatewayResponse noContent() {
        return new GatewayResponse(204, null);
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return the headers; the content length is not included and is computed when
     *         the response is written.
     */
    public Map<String, List<String>> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public GatewayResponse setHeader(String name, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(value);
        headers.put(name, values);
        return this;
    }

    public GatewayResponse addHeader(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>(1)).add(value);
        return this;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getBody() {
        return body;
    }
}
