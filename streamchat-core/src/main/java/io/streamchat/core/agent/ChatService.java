package io.streamchat.core.agent;

import io.streamchat.core.config.model.WebSearchConfig;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ApiResult;
import io.streamchat.core.model.ChatMessage;
import io.streamchat.core.provider.ChatCompletionClient;
import io.streamchat.core.stream.EventChannel;
import java.util.List;
import java.util.Objects;

public final class ChatService {
    static final int MAX_TITLE_LENGTH = 50;

    private final ChatCompletionClient completions;
    private final ToolLoopOrchestrator orchestrator;

    public ChatService(ChatCompletionClient completions, ToolLoopOrchestrator orchestrator) {
        this.completions = Objects.requireNonNull(completions, "completions must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
    }

    public EventChannel streamReply(ApiConfig config, List<ChatMessage> history, WebSearchConfig search) {
        if (search != null && search.usable()) {
            return orchestrator.run(config, history, search);
        }
        return completions.streamChat(config, history);
    }

    public ApiResult<String> testConnection(ApiConfig config) {
        return completions.testConnection(config);
    }

    public ApiResult<List<String>> fetchModels(ApiConfig config) {
        return completions.fetchModels(config);
    }

    public static String generateTitle(String firstMessage) {
        String collapsed = (firstMessage == null ? "" : firstMessage).trim()
            .replace("\n", " ")
            .replaceAll("\\s+", " ");
        if (collapsed.length() <= MAX_TITLE_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, MAX_TITLE_LENGTH - 3) + "...";
    }
}
