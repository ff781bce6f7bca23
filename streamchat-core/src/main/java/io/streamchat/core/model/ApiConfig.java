package io.streamchat.core.model;

public record ApiConfig(
    String baseUrl,
    String apiKey,
    String model,
    String systemPrompt,
    Double temperature,
    Integer maxTokens,
    String providerName
) {
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4";

    public ApiConfig {
        baseUrl = baseUrl == null ? "" : baseUrl;
        apiKey = apiKey == null ? "" : apiKey;
        model = model == null ? "" : model;
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        providerName = providerName == null ? "" : providerName;
    }

    public ApiConfig(String baseUrl, String apiKey, String model) {
        this(baseUrl, apiKey, model, "", null, null, "");
    }

    public boolean isConfigured() {
        return !baseUrl.isBlank() && !apiKey.isBlank() && !model.isBlank();
    }

    public String normalizedBaseUrl() {
        String trimmed = baseUrl.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        return trimmed.substring(0, end);
    }
}
