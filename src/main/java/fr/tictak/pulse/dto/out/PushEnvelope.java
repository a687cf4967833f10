package fr.tictak.pulse.dto.out;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frame body pushed to live sessions: {@code {"type": ..., "data": ...}}.
 */
public record PushEnvelope(String type, Object data) {

    public static final String CONNECTED = "connected";
    public static final String NOTIFICATION = "notification";
    public static final String UNREAD_COUNT = "unread_count";
    public static final String HEARTBEAT = "heartbeat";
    public static final String NOTIFICATION_READ = "notification_read";
    public static final String ERROR = "error";

    public static PushEnvelope connected(String userId, Instant at) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", "Connected to notification stream");
        data.put("userId", userId);
        data.put("timestamp", at.toString());
        return new PushEnvelope(CONNECTED, data);
    }

    public static PushEnvelope notification(Object notification) {
        return new PushEnvelope(NOTIFICATION, notification);
    }

    public static PushEnvelope unreadCount(long count) {
        return new PushEnvelope(UNREAD_COUNT, Map.of("count", count));
    }

    public static PushEnvelope heartbeat(Instant at) {
        return new PushEnvelope(HEARTBEAT, Map.of("timestamp", at.toString()));
    }

    public static PushEnvelope notificationRead(String notificationId, boolean success) {
        return new PushEnvelope(NOTIFICATION_READ, Map.of("notificationId", notificationId, "success", success));
    }

    public static PushEnvelope error(String message) {
        return new PushEnvelope(ERROR, Map.of("message", message));
    }
}
