package io.chronicle.core.migration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.chronicle.core.session.SessionSnapshot;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One session file in the legacy on-disk format. The file name is derived from a sanitized form of
 * the key; {@link #key()} is the authoritative value.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record LegacySession(
    String key,
    List<LegacyMessage> messages,
    String summary,
    OffsetDateTime created,
    OffsetDateTime updated
) {

    LegacySession {
        messages = messages == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(messages));
        summary = summary == null ? "" : summary;
    }

    SessionSnapshot toSnapshot() {
        return new SessionSnapshot(
            key,
            summary,
            created == null ? null : created.toInstant(),
            updated == null ? null : updated.toInstant(),
            messages.stream().map(LegacyMessage::toChatMessage).toList()
        );
    }
}
