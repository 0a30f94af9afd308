package io.chronicle.core.session;

import io.chronicle.core.model.ChatMessage;
import java.time.Instant;
import java.util.Objects;

public record StoredMessage(int seq, ChatMessage message, Instant createdAt) {

    public StoredMessage {
        Objects.requireNonNull(message, "message must not be null");
    }

    public String role() {
        return message.role();
    }

    public String content() {
        return message.content();
    }
}
