package fr.tictak.pulse.model;

import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.NotificationType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@Data
@NoArgsConstructor
@Document(collection = "notification_preferences")
@CompoundIndex(name = "user_type_unique", def = "{'userId': 1, 'notificationType': 1}", unique = true)
public class NotificationPreference {

    @Id
    private String id;
    private String userId;
    private NotificationType notificationType;
    private boolean enabled;
    private boolean inAppEnabled;
    private boolean emailEnabled;
    private boolean pushEnabled;
    private Map<String, Object> settings = new HashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Fail-open default used when the user never stored an override: enabled, in-app only.
     */
    public static NotificationPreference defaults(String userId, NotificationType type) {
        NotificationPreference preference = new NotificationPreference();
        preference.setUserId(userId);
        preference.setNotificationType(type);
        preference.setEnabled(true);
        preference.setInAppEnabled(true);
        preference.setEmailEnabled(false);
        preference.setPushEnabled(false);
        return preference;
    }

    public boolean isChannelEnabled(DeliveryChannel channel) {
        if (!enabled) {
            return false;
        }
        return switch (channel) {
            case IN_APP -> inAppEnabled;
            case EMAIL -> emailEnabled;
            case PUSH -> pushEnabled;
        };
    }

    public Set<DeliveryChannel> enabledChannels() {
        Set<DeliveryChannel> channels = EnumSet.noneOf(DeliveryChannel.class);
        for (DeliveryChannel channel : DeliveryChannel.values()) {
            if (isChannelEnabled(channel)) {
                channels.add(channel);
            }
        }
        return channels;
    }
}
