package io.streamchat.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLHandshakeException;

public final class ApiErrorClassifier {
    public static final String AUTH_FAILED = "Authentication failed. Please check your API key.";
    public static final String NOT_FOUND = "Model not found or invalid endpoint.";
    public static final String MODELS_NOT_FOUND = "Models endpoint not found.";
    public static final String RATE_LIMITED = "Rate limit exceeded. Please try again later.";

    private final ObjectMapper mapper;

    public ApiErrorClassifier(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String describe(Exception e) {
        if (e instanceof SocketTimeoutException) {
            return "Connection timed out. Please check your internet connection and try again.";
        }
        if (e instanceof UnknownHostException) {
            return "Cannot resolve server address. Please check your Base URL and internet connection.";
        }
        if (e instanceof SSLHandshakeException) {
            return "SSL/TLS handshake failed. The server's certificate may be invalid or untrusted.";
        }
        if (e instanceof SSLException) {
            return "SSL/TLS error: " + messageOr(e, "Secure connection failed");
        }
        if (e instanceof ConnectException) {
            return "Connection refused. Please verify the server address and port.";
        }
        if (e instanceof IOException) {
            return "Network error: " + messageOr(e, "Connection failed");
        }
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return "Unexpected error (" + e.getClass().getSimpleName() + "). Please try again.";
        }
        return "Error: " + message;
    }

    public String describeStatus(int code, String body) {
        return describeStatus(code, body, NOT_FOUND);
    }

    public String describeStatus(int code, String body, String notFoundMessage) {
        return switch (code) {
            case 401 -> AUTH_FAILED;
            case 404 -> notFoundMessage;
            case 429 -> RATE_LIMITED;
            default -> {
                String extracted = extractErrorMessage(body);
                yield extracted == null ? "API error: " + code : extracted;
            }
        };
    }

    String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode message = mapper.readTree(body).path("error").path("message");
            if (message.isTextual() && !message.asText().isBlank()) {
                return message.asText();
            }
            return null;
        } catch (IOException ignored) {
            return null;
        }
    }

    private String messageOr(Exception e, String fallback) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? fallback : message;
    }
}
