package com.example.loqueue.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import jakarta.annotation.Nullable;
import org.springframework.stereotype.Component;

/**
 * JSON encoding for job payloads and results. Anything Jackson can serialize may be enqueued or
 * returned from a processor; it is stored as JSON text and read back as a {@link JsonNode}.
 */
@Component
public class PayloadCodec {
    private final ObjectMapper mapper;

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(@Nullable Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Serialize payload JSON failed", e);
        }
    }

    public JsonNode decode(@Nullable String json) {
        if (json == null || json.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Parse payload JSON failed", e);
        }
    }

    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Convert payload to " + type.getSimpleName() + " failed", e);
        }
    }
}
