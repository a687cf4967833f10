package fr.tictak.pulse.dto.out;

import fr.tictak.pulse.model.Notification;

import java.util.List;

public record NotificationListResponse(List<Notification> notifications, long total, long unreadCount) {
}
