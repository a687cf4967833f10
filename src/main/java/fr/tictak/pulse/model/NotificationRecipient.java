package fr.tictak.pulse.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Out-of-band contact data for a user: where e-mail and mobile push deliveries go.
 */
@Data
@NoArgsConstructor
@Document(collection = "notification_recipients")
public class NotificationRecipient {

    @Id
    private String userId;
    private String email;
    private String fcmToken;
    private Instant updatedAt;

    public NotificationRecipient(String userId) {
        this.userId = userId;
    }
}
