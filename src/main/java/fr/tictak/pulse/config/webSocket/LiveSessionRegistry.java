package fr.tictak.pulse.config.webSocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.WebSocketHandlerDecorator;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live STOMP sessions keyed by session id. A user may hold several sessions (tabs, devices).
 * The raw {@link WebSocketSession} is captured through {@link #decorate(WebSocketHandler)} so stale sessions
 * can be closed from the server side.
 */
@Slf4j
@Component
public class LiveSessionRegistry {

    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, WebSocketSession> transports = new ConcurrentHashMap<>();
    private final Clock clock;

    public LiveSessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public void register(String sessionId, String userId) {
        sessions.put(sessionId, new LiveSession(sessionId, userId, clock.instant()));
        log.info("Live session {} opened for user {} ({} live)", sessionId, userId, sessions.size());
    }

    public void subscribed(String sessionId, String subscriptionId) {
        LiveSession session = sessions.get(sessionId);
        if (session != null) {
            session.setSubscriptionId(subscriptionId);
        }
    }

    public void recordPong(String sessionId) {
        LiveSession session = sessions.get(sessionId);
        if (session != null) {
            session.setLastPong(clock.instant());
        }
    }

    public void remove(String sessionId) {
        LiveSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("Live session {} closed for user {}", sessionId, removed.getUserId());
        }
    }

    public List<LiveSession> sessionsOf(String userId) {
        return sessions.values().stream().filter(s -> s.getUserId().equals(userId)).toList();
    }

    public Collection<LiveSession> all() {
        return List.copyOf(sessions.values());
    }

    public List<LiveSession> staleSince(Instant cutoff) {
        return sessions.values().stream().filter(s -> s.getLastPong().isBefore(cutoff)).toList();
    }

    /**
     * Closes the underlying socket. The disconnect event then removes the session.
     */
    public void close(String sessionId, CloseStatus status) {
        WebSocketSession transport = transports.get(sessionId);
        if (transport == null) {
            sessions.remove(sessionId);
            return;
        }
        try {
            transport.close(status);
        } catch (IOException e) {
            log.warn("Failed to close session {}: {}", sessionId, e.getMessage());
            transports.remove(sessionId);
            sessions.remove(sessionId);
        }
    }

    public WebSocketHandler decorate(WebSocketHandler handler) {
        return new WebSocketHandlerDecorator(handler) {
            @Override
            public void afterConnectionEstablished(WebSocketSession session) throws Exception {
                transports.put(session.getId(), session);
                super.afterConnectionEstablished(session);
            }

            @Override
            public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
                transports.remove(session.getId());
                super.afterConnectionClosed(session, closeStatus);
            }
        };
    }

    public static final class LiveSession {
        private final String sessionId;
        private final String userId;
        private final Instant connectedAt;
        private volatile Instant lastPong;
        private volatile String subscriptionId;

        LiveSession(String sessionId, String userId, Instant connectedAt) {
            this.sessionId = sessionId;
            this.userId = userId;
            this.connectedAt = connectedAt;
            this.lastPong = connectedAt;
        }

        public String getSessionId() {
            return sessionId;
        }

        public String getUserId() {
            return userId;
        }

        public Instant getConnectedAt() {
            return connectedAt;
        }

        public Instant getLastPong() {
            return lastPong;
        }

        void setLastPong(Instant lastPong) {
            this.lastPong = lastPong;
        }

        public String getSubscriptionId() {
            return subscriptionId;
        }

        void setSubscriptionId(String subscriptionId) {
            this.subscriptionId = subscriptionId;
        }
    }
}
