package io.streamchat.core.stream;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reassembles tool calls whose fields arrive spread over many chunks. Fragments are keyed by the
 * protocol-supplied index, since the id may show up after the name or the first argument fragment.
 * One instance belongs to exactly one streaming call.
 */
final class ToolCallAggregator {
    static final String NO_TOOL_CALLS = "Received tool_calls finish but no tool calls were accumulated";
    static final String INCOMPLETE_TOOL_CALLS = "One or more tool calls in the stream were incomplete";

    private final Map<Integer, ToolCallFragment> fragments = new TreeMap<>();

    void accept(ToolCallDelta delta) {
        ToolCallFragment fragment = fragments.computeIfAbsent(delta.index(), ignored -> new ToolCallFragment());
        if (delta.id() != null && !delta.id().isEmpty()) {
            fragment.id = delta.id();
        }
        if (delta.name() != null && !delta.name().isEmpty()) {
            fragment.name = delta.name();
        }
        if (delta.arguments() != null && !delta.arguments().isEmpty()) {
            fragment.arguments.append(delta.arguments());
        }
    }

    /**
     * Emits one {@link StreamEvent.ToolCallRequested} per complete fragment in ascending index order, followed by a
     * single error when any fragment lacked an id or a name. Clears all state.
     */
    void finish(EventSink sink) {
        try {
            if (fragments.isEmpty()) {
                sink.emit(new StreamEvent.Error(NO_TOOL_CALLS));
                return;
            }
            boolean incomplete = false;
            for (ToolCallFragment fragment : fragments.values()) {
                if (fragment.id == null || fragment.name == null) {
                    incomplete = true;
                    continue;
                }
                String arguments = fragment.arguments.length() == 0 ? "{}" : fragment.arguments.toString();
                sink.emit(new StreamEvent.ToolCallRequested(fragment.id, fragment.name, arguments));
            }
            if (incomplete) {
                sink.emit(new StreamEvent.Error(INCOMPLETE_TOOL_CALLS));
            }
        } finally {
            fragments.clear();
        }
    }

    void discard() {
        fragments.clear();
    }

    private static final class ToolCallFragment {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
