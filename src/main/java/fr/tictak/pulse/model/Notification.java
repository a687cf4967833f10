package fr.tictak.pulse.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fr.tictak.pulse.model.enums.NotificationType;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A persisted notification. {@code readAt} is set exactly when {@code read} is true; both only change through
 * {@link #markRead(Instant)} and {@link #markUnread()}.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@Document(collection = "notifications")
@CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}")
public class Notification {

    public static final String PRIORITY_KEY = "priority";
    public static final String ACTION_URL_KEY = "action_url";
    public static final String HIGH_PRIORITY = "high";

    @Id
    private String id;
    private String userId;
    private NotificationType type;
    private String title;
    private String message;

    @Setter(AccessLevel.NONE)
    private boolean read;

    @Setter(AccessLevel.NONE)
    private Instant readAt;

    private Map<String, Object> metadata = new HashMap<>();
    private String sourceId;
    private Instant createdAt;

    public Notification(String userId, NotificationType type, String title, String message, Map<String, Object> metadata) {
        this.userId = userId;
        this.type = type;
        this.title = title;
        this.message = message;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    }

    /**
     * @return true if the notification transitioned from unread to read
     */
    public boolean markRead(Instant at) {
        if (read) {
            return false;
        }
        this.read = true;
        this.readAt = at;
        return true;
    }

    public void markUnread() {
        this.read = false;
        this.readAt = null;
    }

    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }

    @JsonIgnore
    public boolean isHighPriority() {
        Object priority = metadata != null ? metadata.get(PRIORITY_KEY) : null;
        return priority != null && HIGH_PRIORITY.equalsIgnoreCase(priority.toString());
    }
}
