package org.javai.storage.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns an HTTP error response into a {@link ServiceException}.
 *
 * <p>The service reports errors as
 * <pre>{@code
 * {"error": {"code": 429, "message": "...", "errors": [{"reason": "rateLimitExceeded", ...}]}}
 * }</pre>
 * A bare top-level {@code errors} list is accepted too. Bodies that are empty, not JSON or
 * lack the envelope still produce a {@code ServiceException}, with no sub-errors and the
 * raw body as message; parsing never fails.
 */
public final class ErrorResponseParser {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper();

    private final ObjectMapper mapper;

    public ErrorResponseParser() {
        this(DEFAULT_MAPPER);
    }

    public ErrorResponseParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public ServiceException parse(int statusCode, String body) {
        return parse(statusCode, body, null);
    }

    /**
     * @param statusCode HTTP status of the response
     * @param body Response body (may be null)
     * @param retryAfterHeader Value of the {@code Retry-After} header (may be null)
     */
    public ServiceException parse(int statusCode, String body, String retryAfterHeader) {
        Duration retryAfter = parseRetryAfter(retryAfterHeader);
        String fallbackMessage = body == null || body.isBlank() ? "HTTP " + statusCode : body.strip();
        if (body == null || body.isBlank()) {
            return new ServiceException(statusCode, fallbackMessage, List.of(), retryAfter);
        }

        JsonNode envelope;
        try {
            envelope = locateEnvelope(mapper.readTree(body));
        } catch (JsonProcessingException e) {
            // Plain-text or HTML bodies from proxies
            return new ServiceException(statusCode, fallbackMessage, List.of(), retryAfter);
        }
        if (envelope == null) {
            return new ServiceException(statusCode, fallbackMessage, List.of(), retryAfter);
        }

        String message = envelope.path("message").isTextual()
                ? envelope.path("message").asText()
                : fallbackMessage;
        return new ServiceException(statusCode, message, readErrors(envelope.path("errors")), retryAfter);
    }

    private static JsonNode locateEnvelope(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode error = root.path("error");
        if (error.isObject()) {
            return error;
        }
        if (root.path("errors").isArray()) {
            return root;
        }
        return null;
    }

    private List<ErrorDetail> readErrors(JsonNode errors) {
        if (!errors.isArray()) {
            return List.of();
        }
        List<ErrorDetail> details = new ArrayList<>(errors.size());
        for (JsonNode node : errors) {
            if (!node.isObject()) {
                continue;
            }
            details.add(new ErrorDetail(
                    text(node, "reason"),
                    text(node, "message"),
                    text(node, "domain"),
                    text(node, "location"),
                    text(node, "locationType")));
        }
        return details;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Parses a {@code Retry-After} header given in delta-seconds.
     * Returns null when absent or not a non-negative integer.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.strip());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            // HTTP-date form is not supported
            return null;
        }
    }
}
