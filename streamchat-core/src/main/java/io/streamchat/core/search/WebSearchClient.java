package io.streamchat.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WebSearchClient implements SearchAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(WebSearchClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    public static final int MAX_QUERY_LENGTH = 400;
    static final int MAX_RESULTS = 5;
    static final String NO_RESULTS = "No results found";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final SearchEndpoints endpoints;

    public WebSearchClient() {
        this(SearchEndpoints.defaults());
    }

    public WebSearchClient(SearchEndpoints endpoints) {
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints must not be null");
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(30))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(30))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String search(String query, String apiKey, String providerName) throws IOException {
        String trimmedQuery = truncate(query == null ? "" : query);
        SearchProvider provider = SearchProvider.fromName(providerName);
        LOG.debug("Searching {} for a {}-character query", provider.id(), trimmedQuery.length());
        return switch (provider) {
            case TAVILY -> searchTavily(trimmedQuery, apiKey);
            case SYNTHETIC -> searchSynthetic(trimmedQuery, apiKey);
            case BRAVE -> searchBrave(trimmedQuery, apiKey);
        };
    }

    public static String truncate(String query) {
        return query.length() <= MAX_QUERY_LENGTH ? query : query.substring(0, MAX_QUERY_LENGTH);
    }

    private String searchBrave(String query, String apiKey) throws IOException {
        HttpUrl url = HttpUrl.get(endpoints.brave()).newBuilder()
            .addQueryParameter("q", query)
            .addQueryParameter("count", String.valueOf(MAX_RESULTS))
            .build();
        Request request = new Request.Builder()
            .url(url)
            .header("X-Subscription-Token", apiKey)
            .header("Accept", "application/json")
            .get()
            .build();

        JsonNode root = execute(request, SearchProvider.BRAVE);
        return format(root == null ? null : root.path("web").path("results"), "description", "page_age");
    }

    private String searchTavily(String query, String apiKey) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("api_key", apiKey);
        payload.put("query", query);
        payload.put("search_depth", "basic");
        payload.put("max_results", MAX_RESULTS);

        Request request = new Request.Builder()
            .url(endpoints.tavily())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

        JsonNode root = execute(request, SearchProvider.TAVILY);
        return format(root == null ? null : root.path("results"), "content", "published_date");
    }

    private String searchSynthetic(String query, String apiKey) throws IOException {
        Request request = new Request.Builder()
            .url(endpoints.synthetic())
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .post(RequestBody.create(mapper.writeValueAsString(Map.of("query", query)), JSON))
            .build();

        JsonNode root = execute(request, SearchProvider.SYNTHETIC);
        return format(root == null ? null : root.path("results"), "text", "published");
    }

    private JsonNode execute(Request request, SearchProvider provider) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                LOG.warn("{} returned HTTP {}", provider.displayName(), response.code());
                throw new IOException(provider.displayName() + ": " + httpErrorMessage(response.code()));
            }
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return mapper.readTree(raw);
            } catch (IOException e) {
                throw new IOException("Failed to parse " + provider.displayName() + " results: " + e.getMessage(), e);
            }
        }
    }

    private String format(JsonNode results, String snippetField, String publishedField) {
        if (results == null || !results.isArray() || results.isEmpty()) {
            return NO_RESULTS;
        }
        List<String> lines = new ArrayList<>();
        int index = 1;
        for (JsonNode result : results) {
            lines.add(index + ". " + textOr(result.get("title"), "No title"));
            lines.add("   URL: " + textOr(result.get("url"), "No URL"));
            String snippet = textOr(result.get(snippetField), "");
            if (!snippet.isBlank()) {
                lines.add("   " + snippet);
            }
            String published = textOr(result.get(publishedField), "");
            if (!published.isBlank()) {
                lines.add("   Published: " + published);
            }
            lines.add("");
            index++;
        }
        return String.join("\n", lines).trim();
    }

    private String textOr(JsonNode node, String fallback) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.asText(fallback);
    }

    static String httpErrorMessage(int code) {
        return switch (code) {
            case 401 -> "Invalid API key (HTTP 401)";
            case 403 -> "Access forbidden (HTTP 403)";
            case 429 -> "Rate limit exceeded, try again later (HTTP 429)";
            default -> "HTTP error " + code;
        };
    }
}
