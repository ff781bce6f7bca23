package io.streamchat.cli;

import io.streamchat.core.config.model.ProviderConfig;
import io.streamchat.core.config.model.StreamchatConfig;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            StreamchatConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Active provider: " + config.activeProvider());
            for (Map.Entry<String, ProviderConfig> entry : config.providers().entrySet()) {
                ProviderConfig provider = entry.getValue();
                System.out.println("Provider " + entry.getKey() + " (" + provider.name() + ") configured: "
                    + provider.configured() + ", model: " + provider.toApiConfig().model());
            }
            System.out.println("Web search: " + (config.webSearch().usable()
                ? "enabled via " + config.webSearch().provider()
                : "disabled"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
