package fr.tictak.pulse.client;

import fr.tictak.pulse.client.resilience.RetryPolicy;
import lombok.Data;

import java.nio.file.Path;

/**
 * Settings of a client session. Defaults target a server running locally on the default port.
 */
@Data
public class PulseClientProperties {

    private String serverUrl = "http://localhost:8084";

    private String webSocketUrl = "ws://localhost:8084/ws/notifications";

    private Path offlineQueueFile = Path.of(System.getProperty("user.home"), ".pulse", "offline-queue.json");

    /** Replay attempts before a queued request is dropped. */
    private int offlineQueueMaxAttempts = 5;

    private RetryPolicy requestRetry = RetryPolicy.defaults();

    private RetryPolicy reconnect = RetryPolicy.reconnectDefaults();

    private int ioThreads = 4;
}
