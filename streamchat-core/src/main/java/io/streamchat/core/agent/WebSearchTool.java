package io.streamchat.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Map;

public final class WebSearchTool {
    public static final String NAME = "web_search";
    private static final ObjectMapper JSON = new ObjectMapper();

    private WebSearchTool() {
    }

    public static Map<String, Object> definition() {
        return Map.of(
            "type", "function",
            "function", Map.of(
                "name", NAME,
                "description", "Search the web for current information. Use this when the user asks about recent "
                    + "events, facts you are unsure about, or anything that needs up-to-date data.",
                "parameters", Map.of(
                    "type", "object",
                    "properties", Map.of(
                        "query", Map.of(
                            "type", "string",
                            "description", "The search query (max 400 characters)")),
                    "required", List.of("query"))));
    }

    public static String extractQuery(String arguments) {
        String raw = arguments == null ? "" : arguments;
        try {
            JsonNode root = JSON.readTree(raw);
            if (root != null && root.isObject()) {
                JsonNode query = root.get("query");
                if (query != null && query.isTextual() && !query.asText().isBlank()) {
                    return query.asText();
                }
            }
        } catch (IOException ignored) {
            // not JSON, use the raw text
        }
        return raw;
    }
}
