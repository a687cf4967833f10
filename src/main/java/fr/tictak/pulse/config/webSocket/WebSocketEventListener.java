package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.dto.out.PushEnvelope;
import fr.tictak.pulse.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;
import org.springframework.web.socket.messaging.SessionSubscribeEvent;

import java.security.Principal;
import java.time.Clock;

@Slf4j
@Service
public class WebSocketEventListener {

    private final LiveSessionRegistry sessionRegistry;
    private final SessionMessenger messenger;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public WebSocketEventListener(LiveSessionRegistry sessionRegistry, SessionMessenger messenger,
                                  NotificationRepository notificationRepository, Clock clock) {
        this.sessionRegistry = sessionRegistry;
        this.messenger = messenger;
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectEvent event) {
        Principal user = event.getUser();
        String sessionId = SimpMessageHeaderAccessor.getSessionId(event.getMessage().getHeaders());
        if (user == null || sessionId == null) {
            log.warn("CONNECT event without principal or session id, ignoring");
            return;
        }
        sessionRegistry.register(sessionId, user.getName());
    }

    /**
     * Greets a session once it subscribes to its notification queue: {@code connected}, then the unread count.
     */
    @EventListener
    public void handleSessionSubscribe(SessionSubscribeEvent event) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.wrap(event.getMessage());
        if (!SessionMessenger.SUBSCRIBED_DESTINATION.equals(accessor.getDestination()) || event.getUser() == null) {
            return;
        }
        String sessionId = accessor.getSessionId();
        String subscriptionId = accessor.getSubscriptionId();
        String userId = event.getUser().getName();
        sessionRegistry.subscribed(sessionId, subscriptionId);

        messenger.toSession(sessionId, subscriptionId, PushEnvelope.connected(userId, clock.instant()));
        long unread = notificationRepository.countByUserIdAndRead(userId, false);
        messenger.toSession(sessionId, subscriptionId, PushEnvelope.unreadCount(unread));
        log.info("Session {} subscribed for user {}, initial unread count {}", sessionId, userId, unread);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        sessionRegistry.remove(event.getSessionId());
    }
}
