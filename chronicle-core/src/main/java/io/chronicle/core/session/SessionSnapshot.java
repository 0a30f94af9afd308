package io.chronicle.core.session;

import io.chronicle.core.model.ChatMessage;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record SessionSnapshot(
    String key,
    String summary,
    Instant createdAt,
    Instant updatedAt,
    List<ChatMessage> messages
) {

    public SessionSnapshot {
        Objects.requireNonNull(key, "key must not be null");
        summary = summary == null ? "" : summary;
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
