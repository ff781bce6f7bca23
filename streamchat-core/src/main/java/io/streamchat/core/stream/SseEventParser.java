package io.streamchat.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SseEventParser {
    private static final Logger LOG = LoggerFactory.getLogger(SseEventParser.class);
    static final String DATA_PREFIX = "data: ";
    static final String DONE_SENTINEL = "[DONE]";

    private final ObjectMapper mapper;

    public SseEventParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public SseFrame parse(String line) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return SseFrame.SKIP;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (DONE_SENTINEL.equals(payload)) {
            return SseFrame.TERMINATE;
        }

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            // partial or noisy frames are dropped, the stream keeps going
            LOG.debug("Skipping malformed stream frame: {}", e.getOriginalMessage());
            return SseFrame.SKIP;
        }
        if (root == null || !root.isObject()) {
            return SseFrame.SKIP;
        }

        JsonNode choice = root.path("choices").path(0);
        JsonNode delta = choice.path("delta");
        return new SseFrame.Chunk(new ChunkDelta(
            optionalText(delta.get("content")),
            optionalText(delta.get("reasoning_content")),
            toolCallDeltas(delta.path("tool_calls")),
            finishReason(choice.get("finish_reason"))
        ));
    }

    private List<ToolCallDelta> toolCallDeltas(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<ToolCallDelta> deltas = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            deltas.add(new ToolCallDelta(
                item.path("index").asInt(0),
                optionalText(item.get("id")),
                optionalText(function.get("name")),
                optionalText(function.get("arguments"))
            ));
        }
        return deltas;
    }

    private String finishReason(JsonNode node) {
        String value = optionalText(node);
        if (value == null || "null".equals(value)) {
            return null;
        }
        return value;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }
}
