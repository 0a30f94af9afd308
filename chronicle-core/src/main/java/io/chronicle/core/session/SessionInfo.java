package io.chronicle.core.session;

import java.time.Instant;

public record SessionInfo(String key, String summary, int messageCount, Instant createdAt, Instant updatedAt) {
}
