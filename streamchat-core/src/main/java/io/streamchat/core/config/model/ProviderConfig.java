package io.streamchat.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.streamchat.core.model.ApiConfig;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    @JsonAlias({"base_url"}) String baseUrl,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"selected_model"}) String model,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    Double temperature,
    @JsonAlias({"max_tokens"}) Integer maxTokens,
    @JsonAlias({"available_models"}) List<String> availableModels
) {

    public ProviderConfig {
        availableModels = availableModels == null
            ? List.of()
            : availableModels.stream().filter(Objects::nonNull).toList();
    }

    public static ProviderConfig defaults() {
        return new ProviderConfig("OpenAI", ApiConfig.DEFAULT_BASE_URL, "", "", "", 0.7, null, List.of());
    }

    public ProviderConfig normalized(String id) {
        List<String> models = availableModels.stream()
            .map(String::trim)
            .filter(modelId -> !modelId.isEmpty())
            .distinct()
            .toList();
        return new ProviderConfig(
            name == null || name.isBlank() ? id : name.trim(),
            trimmed(baseUrl),
            trimmed(apiKey),
            trimmed(model),
            systemPrompt == null ? "" : systemPrompt,
            temperature,
            maxTokens,
            models
        );
    }

    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank() && apiKey != null && !apiKey.isBlank();
    }

    public ApiConfig toApiConfig() {
        String resolvedModel = model;
        if (resolvedModel == null || resolvedModel.isBlank()) {
            resolvedModel = availableModels.isEmpty() ? ApiConfig.DEFAULT_MODEL : availableModels.get(0);
        }
        return new ApiConfig(baseUrl, apiKey, resolvedModel, systemPrompt, temperature, maxTokens, name);
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
