package io.chronicle.core.migration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.chronicle.core.model.ChatMessage;
import io.chronicle.core.model.ToolCall;
import java.util.List;
import java.util.Objects;

/**
 * A message as written by the legacy file store. Every field may be missing; a missing role is
 * stored as an empty role.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LegacyMessage(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content,
    @JsonProperty("tool_call_id") String toolCallId,
    @JsonProperty("tool_calls") List<ToolCall> toolCalls
) {

    static ChatMessage toChatMessage(LegacyMessage message) {
        if (message == null) {
            return ChatMessage.of("", "");
        }
        return new ChatMessage(
            message.role() == null ? "" : message.role(),
            message.content(),
            message.toolCallId(),
            message.toolCalls() == null ? List.of() : message.toolCalls().stream().filter(Objects::nonNull).toList()
        );
    }
}
