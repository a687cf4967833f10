package fr.tictak.pulse.client.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationPage(List<NotificationItem> notifications, long total, long unreadCount) {

    public NotificationPage {
        notifications = notifications != null ? List.copyOf(notifications) : List.of();
    }
}
