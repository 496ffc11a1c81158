package org.cloudplane.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns an error response from the control-plane API into an {@link ApiError}.
 *
 * <p>The API answers failures with a JSON body of the form
 * {@code {"error_code": "...", "message": "..."}}. Every field of a JSON object body is kept
 * in {@link ApiError#details()}; a body that is not JSON becomes the message verbatim.
 * A {@code Retry-After} header is copied into the details so retry policies can honor it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ApiErrorParser parser = new ApiErrorParser();
 * HttpResponse<byte[]> response = httpClient.send(request, BodyHandlers.ofByteArray());
 * if (response.statusCode() >= 400) {
 *     throw parser.parse(response.statusCode(), response.body(), response.headers().map());
 * }
 * }</pre>
 */
public class ApiErrorParser {

    private static final Logger LOGGER = LogManager.getLogger(ApiErrorParser.class);
    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};
    private static final String RETRY_AFTER_HEADER = "Retry-After";

    private final ObjectMapper objectMapper;

    public ApiErrorParser() {
        this(new ObjectMapper());
    }

    public ApiErrorParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Parses an error response.
     *
     * @param statusCode the HTTP status code
     * @param body the raw response body (may be null or empty)
     * @param headers the response headers (may be null)
     * @return the structured error, never null
     */
    public ApiError parse(int statusCode, byte[] body, Map<String, List<String>> headers) {
        String message = null;
        String errorCode = null;
        Map<String, Object> details = new LinkedHashMap<>();

        if (body != null && body.length > 0) {
            String text = new String(body, StandardCharsets.UTF_8);
            Map<String, Object> json = readJsonObject(text);
            if (json != null) {
                details.putAll(json);
                errorCode = asText(json.get("error_code"));
                message = asText(json.get("message"));
                if (message == null) {
                    message = asText(json.get("error"));
                }
            } else {
                message = text.strip();
            }
        }

        String retryAfter = header(headers, RETRY_AFTER_HEADER);
        if (retryAfter != null) {
            details.put(ApiError.RETRY_AFTER_DETAIL, retryAfter);
        }

        if (message == null || message.isEmpty()) {
            message = ErrorCodes.reasonPhrase(statusCode);
        }
        if (errorCode == null || errorCode.isEmpty()) {
            errorCode = ErrorCodes.forStatus(statusCode);
        }
        return new ApiError(statusCode, errorCode, message, details);
    }

    private Map<String, Object> readJsonObject(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            return objectMapper.readValue(trimmed, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Error body is not a JSON object, using it as the message: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String asText(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    private static String header(Map<String, List<String>> headers, String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                List<String> values = entry.getValue();
                if (values != null && !values.isEmpty() && values.get(0) != null && !values.get(0).isBlank()) {
                    return values.get(0).trim();
                }
            }
        }
        return null;
    }
}
