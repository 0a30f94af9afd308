package io.chronicle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content,
    @JsonProperty("tool_call_id") @JsonInclude(JsonInclude.Include.NON_EMPTY) String toolCallId,
    @JsonProperty("tool_calls") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ToolCall> toolCalls
) {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCallId = toolCallId == null ? "" : toolCallId;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage of(String role, String content) {
        return new ChatMessage(role, content, "", List.of());
    }

    public static ChatMessage system(String content) {
        return of(SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return of(ASSISTANT, content);
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(ASSISTANT, content, "", toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(TOOL, content, toolCallId, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
