package io.chronicle.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionCall(String name, String arguments) {

    public FunctionCall {
        name = name == null ? "" : name;
        arguments = arguments == null ? "" : arguments;
    }
}
