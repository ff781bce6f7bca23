package io.streamchat.cli;

import io.streamchat.core.agent.ChatService;
import io.streamchat.core.config.ConfigService;
import io.streamchat.core.config.model.ProviderConfig;
import io.streamchat.core.config.model.StreamchatConfig;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ChatService chatService,
    ConfigService configService,
    Path configPath
) {

    public StreamchatConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public ProviderConfig requireProvider(StreamchatConfig config, String preferred) {
        ProviderConfig provider = config.resolveProvider(preferred)
            .orElseThrow(() -> new IllegalArgumentException(preferred == null
                ? "No providers are defined in " + configPath
                : "Unknown provider: " + preferred));
        if (!provider.configured()) {
            throw new IllegalStateException("Provider '" + provider.name() + "' has no base URL or API key. Edit "
                + configPath + " or run 'streamchat onboard'.");
        }
        return provider;
    }
}
