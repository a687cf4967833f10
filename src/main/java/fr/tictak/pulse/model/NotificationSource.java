package fr.tictak.pulse.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.tictak.pulse.model.enums.SourceType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@Document(collection = "notification_sources")
public class NotificationSource {

    @Id
    private String id;
    @Indexed
    private String userId;
    private SourceType sourceType;
    private String name;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private Map<String, String> credentials = new HashMap<>();

    private Map<String, Object> settings = new HashMap<>();
    private boolean enabled = true;
    private int syncFrequencyMinutes = 15;
    private Instant lastSync;
    private String lastError;
    private long totalCollected;
    private Instant createdAt;
    private Instant updatedAt;
}
