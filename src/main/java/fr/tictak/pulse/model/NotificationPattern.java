package fr.tictak.pulse.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@Document(collection = "notification_patterns")
@CompoundIndex(name = "user_pattern_unique", def = "{'userId': 1, 'patternKey': 1}", unique = true)
public class NotificationPattern {

    @Id
    private String id;
    private String userId;
    private String patternKey;
    private String patternType;
    private double confidence;
    private long frequency;
    private Instant firstSeen;
    private Instant lastOccurrence;
    private Instant lastDecayAt;
}
