package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.out.PushEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.time.Clock;
import java.time.Instant;

/**
 * Application-level heartbeat: every live session gets a {@code heartbeat} frame and must answer with a pong.
 * Sessions silent for longer than the pong tolerance are closed.
 */
@Slf4j
@Component
public class HeartbeatScheduler {

    private final LiveSessionRegistry sessionRegistry;
    private final SessionMessenger messenger;
    private final PulseProperties properties;
    private final Clock clock;

    public HeartbeatScheduler(LiveSessionRegistry sessionRegistry, SessionMessenger messenger,
                              PulseProperties properties, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.messenger = messenger;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${pulse.websocket.heartbeat-interval:PT30S}",
            initialDelayString = "${pulse.websocket.heartbeat-interval:PT30S}")
    public void beat() {
        Instant now = clock.instant();
        closeStaleSessions(now);
        PushEnvelope heartbeat = PushEnvelope.heartbeat(now);
        int sent = 0;
        for (LiveSessionRegistry.LiveSession session : sessionRegistry.all()) {
            if (messenger.toSession(session, heartbeat)) {
                sent++;
            }
        }
        if (sent > 0) {
            log.debug("Heartbeat sent to {} session(s)", sent);
        }
    }

    void closeStaleSessions(Instant now) {
        Instant cutoff = now.minus(properties.getWebsocket().getPongTolerance());
        for (LiveSessionRegistry.LiveSession stale : sessionRegistry.staleSince(cutoff)) {
            log.info("Closing session {} of user {}: no pong since {}", stale.getSessionId(), stale.getUserId(), stale.getLastPong());
            sessionRegistry.close(stale.getSessionId(), CloseStatus.SESSION_NOT_RELIABLE);
        }
    }
}
