package io.streamchat.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamchat.core.config.model.ProviderConfig;
import io.streamchat.core.config.model.StreamchatConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);
    static final double MAX_TEMPERATURE = 2.0;

    private final ObjectMapper mapper = new ObjectMapper();

    public StreamchatConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            LOG.debug("No config at {}, using defaults", configPath);
            return StreamchatConfig.defaults();
        }

        String text = Files.readString(configPath);
        if (text.isBlank()) {
            throw new IOException("Config file is empty: " + configPath);
        }
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IOException("Config file is not valid JSON: " + configPath + " (" + e.getOriginalMessage() + ")", e);
        }
        if (!root.isObject()) {
            throw new IOException("Config file must contain a JSON object: " + configPath);
        }
        return normalize(mapper.treeToValue(root, StreamchatConfig.class), configPath);
    }

    public void save(Path configPath, StreamchatConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config) + "\n");
    }

    /**
     * Writes defaults when the file is missing or {@code overwrite} is set. Otherwise the existing file is
     * validated and rewritten in normalized form, so a broken config fails here rather than mid-chat.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean exists = Files.exists(configPath);
        StreamchatConfig config = exists && !overwrite ? load(configPath) : StreamchatConfig.defaults();
        save(configPath, config);

        List<String> missingKeys = new ArrayList<>();
        config.providers().forEach((id, provider) -> {
            if (!provider.configured()) {
                missingKeys.add(id);
            }
        });
        return new OnboardResult(configPath, !exists, exists && overwrite, config.activeProvider(), missingKeys);
    }

    StreamchatConfig normalize(StreamchatConfig config, Path configPath) throws IOException {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        for (Map.Entry<String, ProviderConfig> entry : config.providers().entrySet()) {
            String id = StreamchatConfig.providerId(entry.getKey());
            if (id.isEmpty() || entry.getValue() == null) {
                LOG.warn("Ignoring provider entry '{}' in {}: missing id or settings", entry.getKey(), configPath);
                continue;
            }
            if (providers.containsKey(id)) {
                throw new IOException("Provider '" + id + "' is defined more than once in " + configPath);
            }
            ProviderConfig provider = entry.getValue().normalized(id);
            validate(id, provider, configPath);
            providers.put(id, provider);
        }
        if (providers.isEmpty()) {
            providers.putAll(StreamchatConfig.defaults().providers());
        }

        String active = StreamchatConfig.providerId(config.activeProvider());
        if (!providers.containsKey(active)) {
            String fallback = providers.keySet().iterator().next();
            if (!active.isEmpty()) {
                LOG.warn("Active provider '{}' is not defined in {}, using '{}'", active, configPath, fallback);
            }
            active = fallback;
        }
        return new StreamchatConfig(active, providers, config.webSearch());
    }

    private void validate(String id, ProviderConfig provider, Path configPath) throws IOException {
        Double temperature = provider.temperature();
        if (temperature != null && (temperature < 0 || temperature > MAX_TEMPERATURE)) {
            throw new IOException("Provider '" + id + "' in " + configPath + ": temperature must be between 0 and "
                + MAX_TEMPERATURE + ", got " + temperature);
        }
        if (provider.maxTokens() != null && provider.maxTokens() <= 0) {
            throw new IOException("Provider '" + id + "' in " + configPath + ": maxTokens must be positive, got "
                + provider.maxTokens());
        }
    }
}
