package fr.tictak.pulse.client.store;

import fr.tictak.pulse.client.api.NotificationItem;
import fr.tictak.pulse.client.api.PreferenceItem;

import java.util.List;
import java.util.Map;

/**
 * Immutable view of the store. Every mutation publishes a new instance.
 */
public record StoreState(
        List<NotificationItem> notifications,
        long unreadCount,
        Map<String, PreferenceItem> preferences,
        boolean connected,
        boolean loading,
        String error
) {

    public StoreState {
        notifications = List.copyOf(notifications);
        preferences = Map.copyOf(preferences);
        unreadCount = Math.max(0, unreadCount);
    }

    static StoreState initial() {
        return new StoreState(List.of(), 0, Map.of(), false, false, null);
    }

    StoreState withNotifications(List<NotificationItem> items, long unread) {
        return new StoreState(items, unread, preferences, connected, loading, error);
    }

    StoreState withUnreadCount(long unread) {
        return new StoreState(notifications, unread, preferences, connected, loading, error);
    }

    StoreState withPreferences(Map<String, PreferenceItem> value) {
        return new StoreState(notifications, unreadCount, value, connected, loading, error);
    }

    StoreState withConnected(boolean value) {
        return new StoreState(notifications, unreadCount, preferences, value, loading, error);
    }

    StoreState withLoading(boolean value) {
        return new StoreState(notifications, unreadCount, preferences, connected, value, error);
    }

    StoreState withError(String value) {
        return new StoreState(notifications, unreadCount, preferences, connected, loading, value);
    }
}
