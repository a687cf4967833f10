package fr.tictak.pulse.client.resilience;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A side-effecting request deferred until connectivity returns.
 */
public record OfflineQueueEntry(
        String id,
        String method,
        String endpoint,
        JsonNode payload,
        Instant enqueuedAt,
        int attempts
) {

    public OfflineQueueEntry withAttempts(int value) {
        return new OfflineQueueEntry(id, method, endpoint, payload, enqueuedAt, value);
    }
}
