package io.streamchat.core.search;

import java.io.IOException;

public interface SearchAdapter {

    String search(String query, String apiKey, String providerName) throws IOException;
}
