package io.streamchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamchatConfig(
    @JsonAlias({"active_provider"}) String activeProvider,
    Map<String, ProviderConfig> providers,
    @JsonAlias({"web_search"}) WebSearchConfig webSearch
) {

    public StreamchatConfig {
        activeProvider = activeProvider == null ? "" : activeProvider;
        providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        webSearch = webSearch == null ? WebSearchConfig.defaults() : webSearch;
    }

    public static StreamchatConfig defaults() {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        providers.put("openai", ProviderConfig.defaults());
        return new StreamchatConfig("openai", providers, WebSearchConfig.defaults());
    }

    public static String providerId(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<ProviderConfig> resolveProvider(String preferred) {
        if (preferred != null && !preferred.isBlank()) {
            return Optional.ofNullable(providers.get(providerId(preferred)));
        }
        ProviderConfig active = providers.get(activeProvider);
        if (active != null && active.configured()) {
            return Optional.of(active);
        }
        Optional<ProviderConfig> firstConfigured = providers.values().stream()
            .filter(ProviderConfig::configured)
            .findFirst();
        return firstConfigured.isPresent() ? firstConfigured : Optional.ofNullable(active);
    }
}
