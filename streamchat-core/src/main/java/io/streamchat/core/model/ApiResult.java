package io.streamchat.core.model;

import java.util.Objects;

public sealed interface ApiResult<T> permits ApiResult.Success, ApiResult.Error {

    static <T> ApiResult<T> success(T data) {
        return new Success<>(data);
    }

    static <T> ApiResult<T> error(String message) {
        return new Error<>(message, null);
    }

    static <T> ApiResult<T> error(String message, Integer code) {
        return new Error<>(message, code);
    }

    record Success<T>(T data) implements ApiResult<T> {
    }

    record Error<T>(String message, Integer code) implements ApiResult<T> {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
