package fr.tictak.pulse.client.platform;

import fr.tictak.pulse.client.api.NotificationItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.SystemTray;
import java.awt.TrayIcon;
import java.awt.image.BufferedImage;

/**
 * Desktop notifications through the AWT system tray. Headless hosts and desktops without a tray report
 * {@link PermissionState#DENIED}.
 */
public class SystemTrayNotifications implements PlatformNotifications {

    private static final Logger log = LoggerFactory.getLogger(SystemTrayNotifications.class);

    private volatile PermissionState state = PermissionState.DEFAULT;
    private volatile TrayIcon trayIcon;

    @Override
    public PermissionState permission() {
        if (!supported()) {
            return PermissionState.DENIED;
        }
        return state;
    }

    @Override
    public synchronized PermissionState requestPermission() {
        if (state != PermissionState.DEFAULT) {
            return state;
        }
        if (!supported()) {
            state = PermissionState.DENIED;
            return state;
        }
        try {
            TrayIcon icon = new TrayIcon(new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB), "Pulse");
            icon.setImageAutoSize(true);
            SystemTray.getSystemTray().add(icon);
            trayIcon = icon;
            state = PermissionState.GRANTED;
        } catch (AWTException e) {
            log.info("System tray refused the notification icon: {}", e.getMessage());
            state = PermissionState.DENIED;
        }
        return state;
    }

    @Override
    public void show(NotificationItem notification) {
        TrayIcon icon = trayIcon;
        if (state != PermissionState.GRANTED || icon == null) {
            return;
        }
        icon.displayMessage(notification.title(), notification.message(), TrayIcon.MessageType.INFO);
    }

    private static boolean supported() {
        return !GraphicsEnvironment.isHeadless() && SystemTray.isSupported();
    }
}
