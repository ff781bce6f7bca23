package io.streamchat.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamchat.core.config.model.WebSearchConfig;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ChatMessage;
import io.streamchat.core.provider.ApiErrorClassifier;
import io.streamchat.core.provider.ChatCompletionClient;
import io.streamchat.core.search.SearchAdapter;
import io.streamchat.core.stream.EventChannel;
import io.streamchat.core.stream.StreamEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ToolLoopOrchestratorTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final WebSearchConfig SEARCH = new WebSearchConfig(true, "search-key", "tavily");

    private MockWebServer server;
    private ApiConfig config;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        config = new ApiConfig(server.url("/v1").toString(), "sk-test", "gpt-4o");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldFinishWithSingleDoneWhenNoToolsRequested() throws Exception {
        server.enqueue(sse(contentChunk("Just ") + contentChunk("an answer") + "data: [DONE]\n\n"));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("hi")), SEARCH).drain();

        assertThat(events).containsExactly(
            new StreamEvent.Content("Just "),
            new StreamEvent.Content("an answer"),
            StreamEvent.DONE);
        assertThat(search.queries).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
        JsonNode body = JSON.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("tools").path(0).path("function").path("name").asText()).isEqualTo("web_search");
        assertThat(body.path("tool_choice").asText()).isEqualTo("auto");
    }

    @Test
    void shouldRunSearchAndResubmitWithToolResult() throws Exception {
        server.enqueue(sse(contentChunk("Let me look. ") + toolCallChunks("a", "{\\\"query\\\":\\\"x\\\"}")));
        server.enqueue(sse(contentChunk("Found it.") + "data: [DONE]\n\n"));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("find x")), SEARCH).drain();

        assertThat(events).containsExactly(
            new StreamEvent.Content("Let me look. "),
            StreamEvent.WEB_SEARCH_STARTED,
            new StreamEvent.Content("Found it."),
            StreamEvent.DONE);
        assertThat(search.queries).containsExactly("x");
        assertThat(search.providers).containsExactly("tavily");

        server.takeRequest();
        JsonNode messages = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(messages).hasSize(3);
        assertThat(messages.path(1).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.path(1).path("content").asText()).isEqualTo("Let me look. ");
        assertThat(messages.path(1).path("tool_calls").path(0).path("id").asText()).isEqualTo("a");
        assertThat(messages.path(2).path("role").asText()).isEqualTo("tool");
        assertThat(messages.path(2).path("tool_call_id").asText()).isEqualTo("a");
        assertThat(messages.path(2).path("content").asText()).isEqualTo("results for x");
    }

    @Test
    void shouldAppendOneToolMessagePerResolvedCall() throws Exception {
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"c1","function":{"name":"web_search","arguments":"{\\"query\\":\\"one\\"}"}},{"index":1,"id":"c2","function":{"name":"web_search","arguments":"two"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        server.enqueue(sse(contentChunk("done") + "data: [DONE]\n\n"));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("two things")), SEARCH).drain();

        assertThat(events).filteredOn(event -> event instanceof StreamEvent.WebSearchStarted).hasSize(2);
        assertThat(search.queries).containsExactly("one", "two");

        server.takeRequest();
        JsonNode messages = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        List<String> toolCallIds = new ArrayList<>();
        for (JsonNode message : messages) {
            if ("tool".equals(message.path("role").asText())) {
                toolCallIds.add(message.path("tool_call_id").asText());
            }
        }
        assertThat(toolCallIds).containsExactly("c1", "c2");
        assertThat(messages.path(1).path("content").isNull()).isTrue();
    }

    @Test
    void shouldAbortAfterFirstSearchFailure() throws Exception {
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"c1","function":{"name":"web_search","arguments":"{\\"query\\":\\"one\\"}"}},{"index":1,"id":"c2","function":{"name":"web_search","arguments":"{\\"query\\":\\"two\\"}"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        SearchAdapter failing = (query, apiKey, provider) -> {
            throw new IOException("Tavily: Invalid API key (HTTP 401)");
        };

        List<StreamEvent> events = new ToolLoopOrchestrator(new ChatCompletionClient(), failing)
            .run(config, List.of(ChatMessage.user("q")), SEARCH)
            .drain();

        assertThat(events).containsExactly(
            StreamEvent.WEB_SEARCH_STARTED,
            new StreamEvent.Error("Web search failed: Tavily: Invalid API key (HTTP 401)"));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldStopOnStreamErrorWithoutDone() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("hi")), SEARCH).drain();

        assertThat(events).containsExactly(new StreamEvent.Error(ApiErrorClassifier.RATE_LIMITED));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldAbortWhenToolCallsAreIncomplete() throws Exception {
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"c1","function":{"name":"web_search","arguments":"{}"}},{"index":1,"function":{"arguments":"{}"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("hi")), SEARCH).drain();

        assertThat(events).hasSize(1);
        assertThat(events.get(0)).isInstanceOf(StreamEvent.Error.class);
        assertThat(search.queries).isEmpty();
    }

    @Test
    void shouldStopSilentlyAfterMaxRounds() throws Exception {
        for (int i = 0; i < ToolLoopOrchestrator.MAX_ROUNDS + 1; i++) {
            server.enqueue(sse(toolCallChunks("call_" + i, "{\\\"query\\\":\\\"again\\\"}")));
        }
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("loop")), SEARCH).drain();

        assertThat(server.getRequestCount()).isEqualTo(ToolLoopOrchestrator.MAX_ROUNDS);
        assertThat(search.queries).hasSize(ToolLoopOrchestrator.MAX_ROUNDS);
        assertThat(events).filteredOn(event -> event instanceof StreamEvent.WebSearchStarted)
            .hasSize(ToolLoopOrchestrator.MAX_ROUNDS);
        assertThat(events.get(events.size() - 1)).isEqualTo(StreamEvent.DONE);
        assertThat(events).filteredOn(event -> event instanceof StreamEvent.Done).hasSize(1);
    }

    @Test
    void shouldAnswerUnknownToolsWithErrorResultAndContinue() throws Exception {
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"c9","function":{"name":"get_weather","arguments":"{}"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        server.enqueue(sse(contentChunk("ok") + "data: [DONE]\n\n"));
        RecordingSearch search = new RecordingSearch();

        List<StreamEvent> events = orchestrator(search).run(config, List.of(ChatMessage.user("weather")), SEARCH).drain();

        assertThat(events).containsExactly(new StreamEvent.Content("ok"), StreamEvent.DONE);
        server.takeRequest();
        JsonNode toolMessage = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages").path(2);
        assertThat(toolMessage.path("tool_call_id").asText()).isEqualTo("c9");
        assertThat(toolMessage.path("content").asText()).isEqualTo("Error: Tool 'get_weather' not found");
    }

    @Test
    void shouldNotStartRemainingSearchesAfterCancellation() throws Exception {
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"c1","function":{"name":"web_search","arguments":"{\\"query\\":\\"one\\"}"}},{"index":1,"id":"c2","function":{"name":"web_search","arguments":"{\\"query\\":\\"two\\"}"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        AtomicReference<EventChannel> channelRef = new AtomicReference<>();
        List<String> queries = new ArrayList<>();
        SearchAdapter cancelling = (query, apiKey, provider) -> {
            queries.add(query);
            while (channelRef.get() == null) {
                Thread.onSpinWait();
            }
            channelRef.get().close();
            return "late result";
        };

        EventChannel channel = new ToolLoopOrchestrator(new ChatCompletionClient(), cancelling)
            .run(config, List.of(ChatMessage.user("q")), SEARCH);
        channelRef.set(channel);

        assertThat(channel.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(queries).containsExactly("one");
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(channel.next()).isNull();
    }

    private ToolLoopOrchestrator orchestrator(SearchAdapter search) {
        return new ToolLoopOrchestrator(new ChatCompletionClient(), search);
    }

    private static String contentChunk(String text) {
        return "data: {\"choices\":[{\"delta\":{\"content\":\"" + text + "\"}}]}\n\n";
    }

    private static String toolCallChunks(String id, String escapedArguments) {
        return "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"" + id
            + "\",\"function\":{\"name\":\"web_search\",\"arguments\":\"\"}}]}}]}\n\n"
            + "data: {\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\""
            + escapedArguments + "\"}}]}}]}\n\n"
            + "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}\n\n";
    }

    private static MockResponse sse(String body) {
        return new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(body);
    }

    private static final class RecordingSearch implements SearchAdapter {
        private final List<String> queries = new ArrayList<>();
        private final List<String> providers = new ArrayList<>();

        @Override
        public String search(String query, String apiKey, String providerName) {
            queries.add(query);
            providers.add(providerName);
            return "results for " + query;
        }
    }
}
