package io.streamchat.cli;

import io.streamchat.core.config.OnboardResult;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Create the config file, or validate and normalize an existing one")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace the existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            if (!overwrite) {
                System.err.println("Fix the file or rerun with --overwrite to start from defaults.");
            }
            return 1;
        }

        String action = result.createdConfig() ? "Created"
            : result.overwrittenConfig() ? "Reset to defaults" : "Validated";
        System.out.println(action + " " + result.configPath() + " (active provider: " + result.activeProvider() + ")");
        for (String id : result.providersMissingKeys()) {
            System.out.println("Provider '" + id + "' needs a baseUrl and apiKey before it can be used.");
        }
        return 0;
    }
}
