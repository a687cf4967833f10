package fr.tictak.pulse.service.channel;

import com.google.firebase.FirebaseApp;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import fr.tictak.pulse.config.AsyncConfig;
import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationRecipient;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.repository.NotificationRecipientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Mobile push through Firebase Cloud Messaging. Metadata values are flattened to strings since FCM data payloads
 * only carry strings.
 */
@Component
public class PushChannelSender implements ChannelSender {

    private static final Logger log = LoggerFactory.getLogger(PushChannelSender.class);

    private final NotificationRecipientRepository recipientRepository;
    private final PulseProperties properties;

    public PushChannelSender(NotificationRecipientRepository recipientRepository, PulseProperties properties) {
        this.recipientRepository = recipientRepository;
        this.properties = properties;
    }

    @Override
    public DeliveryChannel channel() {
        return DeliveryChannel.PUSH;
    }

    @Override
    public boolean isEnabled() {
        return properties.getChannels().getPush().isEnabled() && !FirebaseApp.getApps().isEmpty();
    }

    @Async(AsyncConfig.CHANNEL_EXECUTOR)
    @Override
    public void deliver(Notification notification) {
        String userId = notification.getUserId();
        NotificationRecipient recipient = recipientRepository.findById(userId).orElse(null);
        if (recipient == null || recipient.getFcmToken() == null || recipient.getFcmToken().isEmpty()) {
            log.warn("No FCM token found for user: {}", userId);
            return;
        }

        Message message = Message.builder()
                .setNotification(com.google.firebase.messaging.Notification.builder()
                        .setTitle(notification.getTitle())
                        .setBody(notification.getMessage())
                        .build())
                .putAllData(dataOf(notification))
                .setToken(recipient.getFcmToken())
                .build();

        try {
            FirebaseMessaging.getInstance().send(message);
            log.info("FCM notification {} sent to user {}", notification.getId(), userId);
        } catch (FirebaseMessagingException e) {
            log.error("Failed to send FCM notification to user {}: {}", userId, e.getMessage());
        }
    }

    static Map<String, String> dataOf(Notification notification) {
        Map<String, String> data = new HashMap<>();
        if (notification.getMetadata() != null) {
            notification.getMetadata().forEach((key, value) -> {
                if (value != null) {
                    data.put(key, value.toString());
                }
            });
        }
        if (notification.getId() != null) {
            data.put("notificationId", notification.getId());
        }
        if (notification.getType() != null) {
            data.put("type", notification.getType().getValue());
        }
        return data;
    }
}
