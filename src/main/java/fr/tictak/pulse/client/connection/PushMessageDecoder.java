package fr.tictak.pulse.client.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.tictak.pulse.client.api.NotificationItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decodes {@code {"type": ..., "data": ...}} frames. Unknown types and malformed frames decode to empty.
 */
public class PushMessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(PushMessageDecoder.class);

    private final ObjectMapper mapper;

    public PushMessageDecoder() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public Optional<PushMessage> decode(String frame) {
        JsonNode root;
        try {
            root = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Undecodable push frame ignored: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.hasNonNull("type")) {
            log.warn("Push frame without type ignored");
            return Optional.empty();
        }
        String type = root.get("type").asText();
        JsonNode data = root.path("data");
        try {
            switch (type) {
                case "connected":
                    return Optional.of(new PushMessage.Connected(data.path("userId").asText(null),
                            data.path("message").asText(null)));
                case "notification":
                    return Optional.of(new PushMessage.NotificationPushed(mapper.treeToValue(data, NotificationItem.class)));
                case "unread_count":
                    if (!data.path("count").canConvertToLong()) {
                        log.warn("unread_count frame without a numeric count ignored");
                        return Optional.empty();
                    }
                    return Optional.of(new PushMessage.UnreadCount(data.path("count").asLong()));
                case "heartbeat":
                    return Optional.of(new PushMessage.Heartbeat(data.path("timestamp").asText(null)));
                case "notification_read":
                    return Optional.of(new PushMessage.NotificationRead(data.path("notificationId").asText(null),
                            data.path("success").asBoolean(false)));
                case "error":
                    return Optional.of(new PushMessage.ServerError(data.path("message").asText(null)));
                default:
                    log.warn("Unknown push frame type '{}' ignored", type);
                    return Optional.empty();
            }
        } catch (JsonProcessingException e) {
            log.warn("Malformed '{}' frame ignored: {}", type, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
