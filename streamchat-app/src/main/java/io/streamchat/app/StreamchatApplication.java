package io.streamchat.app;

import io.streamchat.cli.ChatCommand;
import io.streamchat.cli.CliContext;
import io.streamchat.cli.ModelsCommand;
import io.streamchat.cli.OnboardCommand;
import io.streamchat.cli.StatusCommand;
import io.streamchat.cli.StreamchatCliCommand;
import io.streamchat.cli.TestConnectionCommand;
import io.streamchat.core.agent.ChatService;
import io.streamchat.core.agent.ToolLoopOrchestrator;
import io.streamchat.core.config.ConfigPaths;
import io.streamchat.core.config.ConfigService;
import io.streamchat.core.provider.ChatCompletionClient;
import io.streamchat.core.search.WebSearchClient;
import picocli.CommandLine;

public final class StreamchatApplication {

    private StreamchatApplication() {
    }

    public static void main(String[] args) {
        ChatCompletionClient completions = new ChatCompletionClient();
        ToolLoopOrchestrator orchestrator = new ToolLoopOrchestrator(completions, new WebSearchClient());
        ChatService chatService = new ChatService(completions, orchestrator);

        CliContext context = new CliContext(chatService, new ConfigService(), ConfigPaths.fromEnvironment(System.getenv()));

        CommandLine commandLine = new CommandLine(new StreamchatCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("test", new TestConnectionCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
