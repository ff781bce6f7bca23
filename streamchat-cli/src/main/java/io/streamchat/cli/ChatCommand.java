package io.streamchat.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamchat.core.config.model.StreamchatConfig;
import io.streamchat.core.config.model.WebSearchConfig;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ChatMessage;
import io.streamchat.core.model.MessageRole;
import io.streamchat.core.stream.EventChannel;
import io.streamchat.core.stream.StreamEvent;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a prompt and stream the reply")
public final class ChatCommand implements Callable<Integer> {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-H", "--history"}, description = "JSON file with earlier messages: [{\"role\": ..., \"content\": ...}]")
    Path history;

    @Option(names = {"-p", "--provider"}, description = "Provider id from the config file")
    String provider;

    @Option(names = "--no-search", description = "Do not offer the web search tool")
    boolean noSearch;

    @Option(names = "--show-reasoning", description = "Print reasoning tokens to stderr")
    boolean showReasoning;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            StreamchatConfig config = context.loadConfig();
            ApiConfig apiConfig = context.requireProvider(config, provider).toApiConfig();
            WebSearchConfig search = noSearch ? WebSearchConfig.defaults() : config.webSearch();

            List<ChatMessage> messages = new ArrayList<>(readHistory());
            messages.add(ChatMessage.user(prompt));

            try (EventChannel channel = context.chatService().streamReply(apiConfig, messages, search)) {
                return render(channel, System.out, System.err);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Chat interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private int render(EventChannel channel, PrintStream out, PrintStream err) throws InterruptedException {
        boolean wroteContent = false;
        StreamEvent event;
        while ((event = channel.next()) != null) {
            if (event instanceof StreamEvent.Content content) {
                out.print(content.text());
                out.flush();
                wroteContent = true;
            } else if (event instanceof StreamEvent.Reasoning reasoning) {
                if (showReasoning) {
                    err.print(reasoning.text());
                    err.flush();
                }
            } else if (event instanceof StreamEvent.WebSearchStarted) {
                err.println("[searching the web]");
            } else if (event instanceof StreamEvent.Error error) {
                if (wroteContent) {
                    out.println();
                }
                err.println("Chat failed: " + error.message());
                return 1;
            } else if (event instanceof StreamEvent.Done) {
                out.println();
                return 0;
            }
        }
        return 0;
    }

    private List<ChatMessage> readHistory() throws IOException {
        if (history == null) {
            return List.of();
        }
        List<HistoryEntry> entries = JSON.readValue(Files.readString(history), new TypeReference<List<HistoryEntry>>() { });
        List<ChatMessage> messages = new ArrayList<>();
        for (HistoryEntry entry : entries) {
            MessageRole role = MessageRole.fromValue(entry.role());
            if (role == MessageRole.TOOL) {
                throw new IllegalArgumentException("History entries may not use the tool role");
            }
            messages.add(ChatMessage.of(role, entry.content()));
        }
        return messages;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HistoryEntry(String role, String content) {
    }
}
