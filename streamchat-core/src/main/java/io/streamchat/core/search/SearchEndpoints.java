package io.streamchat.core.search;

public record SearchEndpoints(String brave, String tavily, String synthetic) {

    public static SearchEndpoints defaults() {
        return new SearchEndpoints(
            "https://api.search.brave.com/res/v1/web/search",
            "https://api.tavily.com/search",
            "https://api.synthetic.new/v2/search"
        );
    }
}
