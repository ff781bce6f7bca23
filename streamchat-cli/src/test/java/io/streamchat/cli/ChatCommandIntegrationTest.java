package io.streamchat.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamchat.cli.CliTestSupport.Execution;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ChatCommandIntegrationTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    private MockWebServer server;
    private final List<String> searches = new ArrayList<>();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldStreamReplyToStdout() throws Exception {
        Path configPath = writeConfig(false);
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"content":"Hello"}}]}

            data: {"choices":[{"delta":{"reasoning_content":"thinking"}}]}

            data: {"choices":[{"delta":{"content":", world"}}]}

            data: [DONE]

            """));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "hi there");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("Hello, world" + System.lineSeparator());
        assertThat(result.err()).doesNotContain("thinking");
        JsonNode body = JSON.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("mock-model");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("hi there");
    }

    @Test
    void shouldPrintReasoningWhenRequested() throws Exception {
        Path configPath = writeConfig(false);
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"reasoning_content":"thinking"}}]}

            data: {"choices":[{"delta":{"content":"answer"}}]}

            data: [DONE]

            """));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "--show-reasoning", "q");

        assertThat(result.exitCode()).isZero();
        assertThat(result.err()).contains("thinking");
        assertThat(result.out()).contains("answer");
    }

    @Test
    void shouldSendHistoryBeforePrompt() throws Exception {
        Path configPath = writeConfig(false);
        Path history = tempDir.resolve("history.json");
        Files.writeString(history, """
            [
              {"role": "user", "content": "My name is Ada."},
              {"role": "assistant", "content": "Nice to meet you, Ada."}
            ]
            """, StandardCharsets.UTF_8);
        server.enqueue(sse("data: {\"choices\":[{\"delta\":{\"content\":\"Ada\"}}]}\n\ndata: [DONE]\n\n"));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)),
            "--history", history.toString(), "What is my name?");

        assertThat(result.exitCode()).isZero();
        JsonNode messages = JSON.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(messages).hasSize(3);
        assertThat(messages.path(1).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.path(2).path("content").asText()).isEqualTo("What is my name?");
    }

    @Test
    void shouldRunWebSearchRoundWhenEnabled() throws Exception {
        Path configPath = writeConfig(true);
        server.enqueue(sse("""
            data: {"choices":[{"delta":{"tool_calls":[{"index":0,"id":"call_1","function":{"name":"web_search","arguments":"{\\"query\\":\\"java 17\\"}"}}]}}]}

            data: {"choices":[{"delta":{},"finish_reason":"tool_calls"}]}

            """));
        server.enqueue(sse("data: {\"choices\":[{\"delta\":{\"content\":\"Released 2021.\"}}]}\n\ndata: [DONE]\n\n"));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "When was Java 17 released?");

        assertThat(result.exitCode()).isZero();
        assertThat(result.err()).contains("[searching the web]");
        assertThat(result.out()).contains("Released 2021.");
        assertThat(searches).containsExactly("java 17");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldSkipSearchToolWithNoSearchFlag() throws Exception {
        Path configPath = writeConfig(true);
        server.enqueue(sse("data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}\n\ndata: [DONE]\n\n"));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "--no-search", "hi");

        assertThat(result.exitCode()).isZero();
        assertThat(JSON.readTree(server.takeRequest().getBody().readUtf8()).has("tools")).isFalse();
    }

    @Test
    void shouldExitWithErrorOnAuthFailure() throws Exception {
        Path configPath = writeConfig(false);
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":{\"message\":\"bad key\"}}"));

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "hi");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Chat failed: Authentication failed. Please check your API key.");
    }

    @Test
    void shouldRejectUnknownProvider() throws Exception {
        Path configPath = writeConfig(false);

        Execution result = CliTestSupport.execute(new ChatCommand(context(configPath)), "--provider", "nope", "hi");

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Unknown provider: nope");
        assertThat(server.getRequestCount()).isZero();
    }

    private CliContext context(Path configPath) {
        return CliTestSupport.context(configPath, (query, apiKey, provider) -> {
            searches.add(query);
            return "1. Java 17\n   URL: https://openjdk.org/projects/jdk/17/";
        });
    }

    private Path writeConfig(boolean searchEnabled) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, CliTestSupport.configJson(server.url("/v1/").toString(), searchEnabled),
            StandardCharsets.UTF_8);
        return configPath;
    }

    private static MockResponse sse(String body) {
        return new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(body);
    }
}
