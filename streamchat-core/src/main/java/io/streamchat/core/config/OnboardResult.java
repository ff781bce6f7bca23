package io.streamchat.core.config;

import java.nio.file.Path;
import java.util.List;

public record OnboardResult(
    Path configPath,
    boolean createdConfig,
    boolean overwrittenConfig,
    String activeProvider,
    List<String> providersMissingKeys
) {

    public OnboardResult {
        providersMissingKeys = providersMissingKeys == null ? List.of() : List.copyOf(providersMissingKeys);
    }
}
