package io.streamchat.core.stream;

import java.util.Objects;

/**
 * Events delivered to the consumer of a chat stream. A stream ends with exactly one {@link Done} or one
 * terminal {@link Error}, unless it was cancelled by the consumer.
 */
public sealed interface StreamEvent permits
    StreamEvent.Content,
    StreamEvent.Reasoning,
    StreamEvent.Error,
    StreamEvent.ToolCallRequested,
    StreamEvent.WebSearchStarted,
    StreamEvent.Done {

    WebSearchStarted WEB_SEARCH_STARTED = new WebSearchStarted();
    Done DONE = new Done();

    record Content(String text) implements StreamEvent {
        public Content {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record Reasoning(String text) implements StreamEvent {
        public Reasoning {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    record Error(String message) implements StreamEvent {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    record ToolCallRequested(String id, String name, String arguments) implements StreamEvent {
        public ToolCallRequested {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
        }
    }

    record WebSearchStarted() implements StreamEvent {
    }

    record Done() implements StreamEvent {
    }
}
