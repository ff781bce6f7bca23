package io.streamchat.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ApiResult;
import io.streamchat.core.model.ChatMessage;
import io.streamchat.core.model.MessageRole;
import io.streamchat.core.model.ToolCall;
import io.streamchat.core.stream.CompletionStreamDecoder;
import io.streamchat.core.stream.EventChannel;
import io.streamchat.core.stream.EventSink;
import io.streamchat.core.stream.SseEventParser;
import io.streamchat.core.stream.StreamEvent;
import io.streamchat.core.stream.StreamExecutors;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChatCompletionClient {
    private static final Logger LOG = LoggerFactory.getLogger(ChatCompletionClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String CONNECTION_TEST_PROMPT = "Say 'Connection successful!' in exactly those words.";
    static final String CONNECTION_OK = "Connection successful!";
    static final String NOT_CONFIGURED = "API is not configured. Please set the base URL, API key and model.";

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final ExecutorService executor;
    private final ApiErrorClassifier errors;
    private final SseEventParser parser;

    public ChatCompletionClient() {
        this(defaultHttpClient(), StreamExecutors.shared());
    }

    public ChatCompletionClient(OkHttpClient client, ExecutorService executor) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.mapper = new ObjectMapper();
        this.errors = new ApiErrorClassifier(mapper);
        this.parser = new SseEventParser(mapper);
    }

    public static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(30))
            .readTimeout(Duration.ofSeconds(60))
            .writeTimeout(Duration.ofSeconds(30))
            .build();
    }

    public ApiErrorClassifier errors() {
        return errors;
    }

    public EventChannel streamChat(ApiConfig config, List<ChatMessage> messages) {
        return streamChat(config, messages, List.of());
    }

    public EventChannel streamChat(ApiConfig config, List<ChatMessage> messages, List<Map<String, Object>> tools) {
        return EventChannel.open(executor, sink -> streamInto(config, messages, tools, sink));
    }

    public void streamInto(ApiConfig config, List<ChatMessage> messages, List<Map<String, Object>> tools, EventSink sink) {
        if (!config.isConfigured()) {
            sink.emit(new StreamEvent.Error(NOT_CONFIGURED));
            return;
        }

        CompletionStreamDecoder decoder = new CompletionStreamDecoder(parser, sink);
        try {
            Request request = buildStreamRequest(config, messages, tools);
            Call call = client.newCall(request);
            sink.bindCancellation(call::cancel);
            LOG.debug("Streaming completion from {} with model {}", request.url(), config.model());

            try (Response response = call.execute()) {
                if (!response.isSuccessful()) {
                    String errorBody = bodyString(response);
                    LOG.warn("Completion request failed with HTTP {}", response.code());
                    decoder.abandon();
                    sink.emit(new StreamEvent.Error(errors.describeStatus(response.code(), errorBody)));
                    return;
                }

                ResponseBody body = response.body();
                if (body != null) {
                    readLines(body.source(), decoder, sink);
                }
                if (sink.isCancelled()) {
                    decoder.abandon();
                    return;
                }
                decoder.finish();
            }
        } catch (IOException | RuntimeException e) {
            decoder.abandon();
            if (sink.isCancelled()) {
                LOG.debug("Stream cancelled: {}", e.getMessage());
                return;
            }
            LOG.warn("Completion stream failed: {}", e.toString());
            sink.emit(new StreamEvent.Error(errors.describe(e)));
        } finally {
            sink.bindCancellation(null);
        }
    }

    private void readLines(BufferedSource source, CompletionStreamDecoder decoder, EventSink sink) throws IOException {
        String line;
        while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
            if (!decoder.accept(line)) {
                return;
            }
        }
    }

    public ApiResult<String> testConnection(ApiConfig config) {
        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("model", config.model());
            payload.put("messages", toWireMessages(List.of(ChatMessage.user(CONNECTION_TEST_PROMPT))));
            payload.put("stream", false);
            payload.put("temperature", 0.1);
            payload.put("max_tokens", 20);

            Request request = authorized(config, endpoint(config, "chat", "completions"))
                .header("Content-Type", "application/json")
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();

            try (Response response = client.newCall(request).execute()) {
                String body = bodyString(response);
                if (!response.isSuccessful()) {
                    return ApiResult.error(errors.describeStatus(response.code(), body), response.code());
                }
                return ApiResult.success(firstChoiceContent(body));
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Connection test failed: {}", e.toString());
            return ApiResult.error(errors.describe(e));
        }
    }

    public ApiResult<List<String>> fetchModels(ApiConfig config) {
        try {
            Request request = authorized(config, endpoint(config, "models"))
                .header("Content-Type", "application/json")
                .get()
                .build();

            try (Response response = client.newCall(request).execute()) {
                String body = bodyString(response);
                if (!response.isSuccessful()) {
                    return ApiResult.error(
                        errors.describeStatus(response.code(), body, ApiErrorClassifier.MODELS_NOT_FOUND),
                        response.code()
                    );
                }
                return parseModels(body);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Model listing failed: {}", e.toString());
            return ApiResult.error(errors.describe(e));
        }
    }

    private ApiResult<List<String>> parseModels(String body) {
        try {
            JsonNode data = mapper.readTree(body).path("data");
            if (!data.isArray()) {
                return ApiResult.error("Failed to parse models response: missing data array");
            }
            List<String> ids = new ArrayList<>();
            for (JsonNode model : data) {
                String id = model.path("id").asText("");
                if (!id.isBlank()) {
                    ids.add(id);
                }
            }
            ids.sort(null);
            return ApiResult.success(List.copyOf(ids));
        } catch (IOException e) {
            return ApiResult.error("Failed to parse models response: " + e.getMessage());
        }
    }

    private String firstChoiceContent(String body) {
        try {
            JsonNode content = mapper.readTree(body).path("choices").path(0).path("message").path("content");
            return content.isTextual() ? content.asText() : CONNECTION_OK;
        } catch (IOException e) {
            LOG.debug("Unreadable connection test reply: {}", e.getMessage());
            return CONNECTION_OK;
        }
    }

    Request buildStreamRequest(ApiConfig config, List<ChatMessage> messages, List<Map<String, Object>> tools)
        throws IOException {
        List<ChatMessage> allMessages = new ArrayList<>();
        if (!config.systemPrompt().isBlank()) {
            allMessages.add(ChatMessage.system(config.systemPrompt()));
        }
        allMessages.addAll(messages);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", toWireMessages(allMessages));
        payload.put("stream", true);
        if (config.temperature() != null) {
            payload.put("temperature", config.temperature());
        }
        if (config.maxTokens() != null) {
            payload.put("max_tokens", config.maxTokens());
        }
        if (tools != null && !tools.isEmpty()) {
            payload.put("tools", tools);
            payload.put("tool_choice", "auto");
        }

        return authorized(config, endpoint(config, "chat", "completions"))
            .header("Content-Type", "application/json")
            .header("Accept", "text/event-stream")
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();
    }

    private Request.Builder authorized(ApiConfig config, HttpUrl url) {
        return new Request.Builder()
            .url(url)
            .header("Authorization", "Bearer " + config.apiKey());
    }

    private HttpUrl endpoint(ApiConfig config, String... segments) {
        HttpUrl base = HttpUrl.parse(config.normalizedBaseUrl());
        if (base == null) {
            throw new IllegalArgumentException("Invalid base URL: " + config.baseUrl());
        }
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().value());
            row.put("content", message.content());
            if (message.role() == MessageRole.ASSISTANT && message.hasToolCalls()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL) {
                row.put("tool_call_id", message.toolCallId());
            }
            if (message.name() != null && !message.name().isBlank()) {
                row.put("name", message.name());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", call.arguments());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String bodyString(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }
}
