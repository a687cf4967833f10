package fr.tictak.pulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pulse")
public class PulseProperties {

    private WebSocket websocket = new WebSocket();
    private Channels channels = new Channels();
    private Patterns patterns = new Patterns();
    private Cleanup cleanup = new Cleanup();
    private Batch batch = new Batch();
    private Sources sources = new Sources();

    @Data
    public static class WebSocket {
        private String endpoint = "/ws/notifications";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration pongTolerance = Duration.ofSeconds(75);
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Channels {
        private Email email = new Email();
        private Push push = new Push();
    }

    @Data
    public static class Email {
        private boolean enabled = true;
        private String from = "notifications@tictak.fr";
    }

    @Data
    public static class Push {
        private boolean enabled = false;
        private String credentialsFile = "firebase-service-account.json";
    }

    @Data
    public static class Patterns {
        private List<String> signatureKeys = new ArrayList<>(List.of("pattern_key", "big_rock", "source_id", "category"));
        private Duration staleAfter = Duration.ofDays(7);
        private double decayFactor = 0.9;
        private double initialConfidence = 0.5;
        private double confidenceStep = 0.1;
    }

    @Data
    public static class Cleanup {
        private Duration readRetention = Duration.ofDays(30);
        private String cron = "0 30 3 * * *";
    }

    @Data
    public static class Batch {
        private int concurrency = 3;
    }

    @Data
    public static class Sources {
        private int syncLimitPerHour = 20;
        private Duration collectionInterval = Duration.ofMinutes(5);
    }
}
