package io.streamchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebSearchConfig(
    boolean enabled,
    @JsonAlias({"api_key"}) String apiKey,
    String provider
) {

    public WebSearchConfig {
        apiKey = apiKey == null ? "" : apiKey;
        provider = provider == null || provider.isBlank() ? "brave" : provider;
    }

    public static WebSearchConfig defaults() {
        return new WebSearchConfig(false, "", "brave");
    }

    public boolean usable() {
        return enabled && !apiKey.isBlank();
    }
}
