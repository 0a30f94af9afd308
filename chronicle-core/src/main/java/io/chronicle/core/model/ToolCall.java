package io.chronicle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured tool invocation requested by the model.
 *
 * <p>Providers disagree on the wire shape: OpenAI-style calls carry {@code type} and a nested
 * {@link FunctionCall} whose arguments are a raw JSON string, while others use a flat {@code name}
 * plus an argument map. Both shapes are kept so a stored call reads back exactly as written.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(
    String id,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) String type,
    @JsonInclude(JsonInclude.Include.NON_NULL) FunctionCall function,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) String name,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> arguments
) {

    public ToolCall {
        id = id == null ? "" : id;
        type = type == null ? "" : type;
        name = name == null ? "" : name;
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCall ofFunction(String id, String name, String argumentsJson) {
        return new ToolCall(id, "function", new FunctionCall(name, argumentsJson), "", Map.of());
    }

    public static ToolCall named(String id, String name, Map<String, Object> arguments) {
        return new ToolCall(id, "", null, name, arguments);
    }

    public String resolvedName() {
        return function != null && !function.name().isBlank() ? function.name() : name;
    }
}
