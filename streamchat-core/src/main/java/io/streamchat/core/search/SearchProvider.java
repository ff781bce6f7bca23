package io.streamchat.core.search;

import java.util.Locale;

public enum SearchProvider {
    BRAVE("brave", "Brave Search"),
    TAVILY("tavily", "Tavily"),
    SYNTHETIC("synthetic", "Synthetic Search");

    private final String id;
    private final String displayName;

    SearchProvider(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public static SearchProvider fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (SearchProvider provider : values()) {
            if (provider.id.equals(normalized)) {
                return provider;
            }
        }
        return BRAVE;
    }
}
