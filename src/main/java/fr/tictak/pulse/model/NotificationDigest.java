package fr.tictak.pulse.model;

import fr.tictak.pulse.model.enums.DigestType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One generated digest version. Covers the half-open interval [periodStart, periodEnd).
 */
@Data
@NoArgsConstructor
@Document(collection = "notification_digests")
@CompoundIndex(name = "user_type_created_idx", def = "{'userId': 1, 'digestType': 1, 'createdAt': -1}")
public class NotificationDigest {

    @Id
    private String id;
    private String userId;
    private DigestType digestType;
    private Instant periodStart;
    private Instant periodEnd;
    private String summaryText;
    private long notificationCount;
    private long unreadCount;
    private long highPriorityCount;
    private Map<String, Long> countsByType = new LinkedHashMap<>();
    private Instant createdAt;
}
