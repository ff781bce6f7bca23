package io.streamchat.core.agent;

import io.streamchat.core.config.model.WebSearchConfig;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ChatMessage;
import io.streamchat.core.model.ToolCall;
import io.streamchat.core.provider.ChatCompletionClient;
import io.streamchat.core.search.SearchAdapter;
import io.streamchat.core.search.WebSearchClient;
import io.streamchat.core.stream.EventChannel;
import io.streamchat.core.stream.EventSink;
import io.streamchat.core.stream.StreamEvent;
import io.streamchat.core.stream.StreamExecutors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolLoopOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(ToolLoopOrchestrator.class);
    public static final int MAX_ROUNDS = 5;

    private final ChatCompletionClient completions;
    private final SearchAdapter searchAdapter;
    private final ExecutorService executor;

    public ToolLoopOrchestrator(ChatCompletionClient completions, SearchAdapter searchAdapter) {
        this(completions, searchAdapter, StreamExecutors.shared());
    }

    public ToolLoopOrchestrator(ChatCompletionClient completions, SearchAdapter searchAdapter, ExecutorService executor) {
        this.completions = Objects.requireNonNull(completions, "completions must not be null");
        this.searchAdapter = Objects.requireNonNull(searchAdapter, "searchAdapter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    public EventChannel run(ApiConfig config, List<ChatMessage> history, WebSearchConfig search) {
        return EventChannel.open(executor, sink -> runRounds(config, history, search, sink));
    }

    void runRounds(ApiConfig config, List<ChatMessage> history, WebSearchConfig search, EventSink sink) {
        List<ChatMessage> running = new ArrayList<>(history);
        List<Map<String, Object>> tools = List.of(WebSearchTool.definition());

        for (int round = 1; round <= MAX_ROUNDS; round++) {
            if (sink.isCancelled()) {
                return;
            }
            LOG.debug("Starting round {} with {} messages", round, running.size());
            RoundCollector collector = new RoundCollector(sink);
            completions.streamInto(config, running, tools, collector);

            if (collector.failed() || sink.isCancelled()) {
                return;
            }
            if (collector.toolCalls().isEmpty()) {
                break;
            }

            running.add(ChatMessage.assistantWithToolCalls(collector.content(), collector.toolCalls()));
            for (ToolCall call : collector.toolCalls()) {
                if (sink.isCancelled()) {
                    return;
                }
                if (!WebSearchTool.NAME.equals(call.name())) {
                    LOG.warn("Model requested unknown tool {}", call.name());
                    running.add(ChatMessage.tool("Error: Tool '" + call.name() + "' not found", call.id()));
                    continue;
                }
                if (!executeSearch(call, search, running, sink)) {
                    return;
                }
            }
        }
        sink.emit(StreamEvent.DONE);
    }

    private boolean executeSearch(ToolCall call, WebSearchConfig search, List<ChatMessage> running, EventSink sink) {
        String query = WebSearchClient.truncate(WebSearchTool.extractQuery(call.arguments()));
        sink.emit(StreamEvent.WEB_SEARCH_STARTED);
        String result;
        try {
            result = searchAdapter.search(query, search.apiKey(), search.provider());
        } catch (IOException | RuntimeException e) {
            if (sink.isCancelled()) {
                return false;
            }
            LOG.warn("Web search via {} failed: {}", search.provider(), e.getMessage());
            sink.emit(new StreamEvent.Error("Web search failed: " + searchFailure(e)));
            return false;
        }
        if (sink.isCancelled()) {
            return false;
        }
        running.add(ChatMessage.tool(result, call.id()));
        return true;
    }

    private String searchFailure(Exception e) {
        // adapters report provider failures as plain IOExceptions with a ready-made message
        if (e.getClass() == IOException.class && e.getMessage() != null && !e.getMessage().isBlank()) {
            return e.getMessage();
        }
        return completions.errors().describe(e);
    }

    private static final class RoundCollector implements EventSink {
        private final EventSink outer;
        private final StringBuilder content = new StringBuilder();
        private final List<ToolCall> toolCalls = new ArrayList<>();
        private boolean failed;

        private RoundCollector(EventSink outer) {
            this.outer = outer;
        }

        @Override
        public boolean emit(StreamEvent event) {
            if (event instanceof StreamEvent.Content text) {
                content.append(text.text());
                return outer.emit(event);
            }
            if (event instanceof StreamEvent.Reasoning) {
                return outer.emit(event);
            }
            if (event instanceof StreamEvent.Error) {
                failed = true;
                return outer.emit(event);
            }
            if (event instanceof StreamEvent.ToolCallRequested requested) {
                toolCalls.add(new ToolCall(requested.id(), requested.name(), requested.arguments()));
                return !outer.isCancelled();
            }
            if (event instanceof StreamEvent.Done || event instanceof StreamEvent.WebSearchStarted) {
                return !outer.isCancelled();
            }
            throw new IllegalStateException("Unhandled stream event " + event);
        }

        @Override
        public boolean isCancelled() {
            return outer.isCancelled();
        }

        @Override
        public void bindCancellation(Runnable cancelAction) {
            outer.bindCancellation(cancelAction);
        }

        private boolean failed() {
            return failed;
        }

        private List<ToolCall> toolCalls() {
            return toolCalls;
        }

        private String content() {
            return content.length() == 0 ? null : content.toString();
        }
    }
}
