package fr.tictak.pulse.client.platform;

import fr.tictak.pulse.client.api.NotificationItem;

/**
 * Operating system notifications shown next to the in-app list.
 */
public interface PlatformNotifications {

    PermissionState permission();

    PermissionState requestPermission();

    void show(NotificationItem notification);
}
