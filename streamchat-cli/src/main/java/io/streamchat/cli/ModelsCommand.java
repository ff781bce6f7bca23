package io.streamchat.cli;

import io.streamchat.core.config.model.StreamchatConfig;
import io.streamchat.core.model.ApiResult;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "models", description = "List the models a provider offers")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-p", "--provider"}, description = "Provider id from the config file")
    String provider;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            StreamchatConfig config = context.loadConfig();
            ApiResult<List<String>> result = context.chatService()
                .fetchModels(context.requireProvider(config, provider).toApiConfig());
            if (result instanceof ApiResult.Error<List<String>> error) {
                System.err.println("Models request failed: " + error.message());
                return 1;
            }
            List<String> models = ((ApiResult.Success<List<String>>) result).data();
            if (models.isEmpty()) {
                System.out.println("No models reported");
            }
            models.forEach(System.out::println);
            return 0;
        } catch (Exception e) {
            System.err.println("Models command failed: " + e.getMessage());
            return 1;
        }
    }
}
