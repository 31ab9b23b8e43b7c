package com.magicfolder.dispatch.server;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.magicfolder.core.model.ClassificationRequest;
import com.magicfolder.core.model.ClassificationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format for the request/reply channel.
 * <p>
 * Requests are {@code {"files": [...]}} or the legacy {@code {"path": "..."}};
 * both decode to a {@link ClassificationRequest}. Non-string and blank entries
 * in {@code files} are skipped.
 * <p>
 * Output uses {@code ", "} and {@code ": "} separators on one line. The native
 * folder client scans replies for {@code "category": "} literally.
 */
@Component
public class RequestCodec {

    private static final Logger log = LoggerFactory.getLogger(RequestCodec.class);

    static final String NO_PATH = "No path provided";

    private final ObjectMapper objectMapper;
    private final ObjectWriter wireWriter;

    public RequestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.wireWriter = objectMapper.writer(new WireSeparators());
    }

    public ClassificationRequest decodeRequest(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            throw new RequestParseException("Malformed request: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new RequestParseException("Malformed request: expected a JSON object");
        }

        var paths = new ArrayList<String>();
        JsonNode files = root.get("files");
        if (files != null && files.isArray()) {
            for (JsonNode entry : files) {
                addIfPath(paths, entry);
            }
        } else if (files != null) {
            addIfPath(paths, files);
        }
        if (paths.isEmpty()) {
            addIfPath(paths, root.get("path"));
        }
        if (paths.isEmpty()) {
            throw new RequestParseException(NO_PATH);
        }
        return new ClassificationRequest(paths);
    }

    public String encodeRequest(List<String> paths) {
        try {
            return wireWriter.writeValueAsString(Map.of("files", paths));
        } catch (JsonProcessingException e) {
            throw new RequestParseException("Could not encode request: " + e.getOriginalMessage(), e);
        }
    }

    public ClassificationResponse decodeResponse(String json) {
        try {
            return objectMapper.readValue(json, ClassificationResponse.class);
        } catch (JsonProcessingException e) {
            throw new RequestParseException("Malformed reply: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeResponse(ClassificationResponse response) {
        try {
            return wireWriter.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.error("Could not encode response: {}", e.getMessage());
            return errorReply("Internal error: could not encode response");
        }
    }

    public String errorReply(String message) {
        try {
            return wireWriter.writeValueAsString(ClassificationResponse.ofError(message));
        } catch (JsonProcessingException e) {
            log.error("Could not encode error reply: {}", e.getMessage());
            return "{\"error\": \"Internal error\"}";
        }
    }

    private static void addIfPath(List<String> paths, JsonNode node) {
        if (node != null && node.isTextual() && !node.asText().isBlank()) {
            paths.add(node.asText());
        }
    }

    /** Single-line output with a space after every comma and colon. */
    static final class WireSeparators extends MinimalPrettyPrinter {

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
