package io.chronicle.core.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chronicle.core.model.ToolCall;
import java.io.IOException;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * The {@code tool_calls_json} column: either absent (SQL NULL) or a JSON array of tool calls.
 * Decoding happens only when a value is present.
 */
final class ToolCallsJson {
    private static final TypeReference<List<ToolCall>> TOOL_CALLS = new TypeReference<>() {
    };
    private static final ToolCallsJson ABSENT = new ToolCallsJson(null);

    private final String json;

    private ToolCallsJson(String json) {
        this.json = json;
    }

    static ToolCallsJson encode(ObjectMapper mapper, List<ToolCall> toolCalls) throws IOException {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return ABSENT;
        }
        return new ToolCallsJson(mapper.writeValueAsString(toolCalls));
    }

    static ToolCallsJson fromColumn(String value) {
        return value == null || value.isEmpty() ? ABSENT : new ToolCallsJson(value);
    }

    boolean isPresent() {
        return json != null;
    }

    List<ToolCall> decode(ObjectMapper mapper) throws IOException {
        if (!isPresent()) {
            return List.of();
        }
        return mapper.readValue(json, TOOL_CALLS);
    }

    void bind(PreparedStatement statement, int index) throws SQLException {
        if (isPresent()) {
            statement.setString(index, json);
        } else {
            statement.setNull(index, Types.VARCHAR);
        }
    }
}
