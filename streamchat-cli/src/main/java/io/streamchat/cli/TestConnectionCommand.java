package io.streamchat.cli;

import io.streamchat.core.config.model.ProviderConfig;
import io.streamchat.core.model.ApiConfig;
import io.streamchat.core.model.ApiResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "test", description = "Send a short non-streaming request to check provider settings")
public final class TestConnectionCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-p", "--provider"}, description = "Provider id from the config file")
    String provider;

    public TestConnectionCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ProviderConfig selected = context.requireProvider(context.loadConfig(), provider);
            ApiConfig apiConfig = selected.toApiConfig();
            ApiResult<String> result = context.chatService().testConnection(apiConfig);
            if (result instanceof ApiResult.Success<String> success) {
                System.out.println(selected.name() + " (" + apiConfig.model() + "): " + success.data());
                return 0;
            }
            System.err.println("Connection test failed: " + ((ApiResult.Error<String>) result).message());
            return 1;
        } catch (Exception e) {
            System.err.println("Test command failed: " + e.getMessage());
            return 1;
        }
    }
}
