package fr.tictak.pulse.client.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * Client copy of a notification. Immutable; {@link #markedRead(Instant)} returns a new instance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationItem(
        String id,
        String userId,
        String type,
        String title,
        String message,
        boolean read,
        Instant readAt,
        Map<String, Object> metadata,
        String sourceId,
        Instant createdAt
) {

    public NotificationItem {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public NotificationItem markedRead(Instant at) {
        if (read) {
            return this;
        }
        return new NotificationItem(id, userId, type, title, message, true, at, metadata, sourceId, createdAt);
    }
}
