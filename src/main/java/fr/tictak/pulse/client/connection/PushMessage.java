package fr.tictak.pulse.client.connection;

import fr.tictak.pulse.client.api.NotificationItem;

/**
 * Frames the server pushes on the live connection.
 */
public sealed interface PushMessage {

    record Connected(String userId, String message) implements PushMessage {
    }

    record NotificationPushed(NotificationItem notification) implements PushMessage {
    }

    record UnreadCount(long count) implements PushMessage {
    }

    record Heartbeat(String timestamp) implements PushMessage {
    }

    record NotificationRead(String notificationId, boolean success) implements PushMessage {
    }

    record ServerError(String message) implements PushMessage {
    }
}
