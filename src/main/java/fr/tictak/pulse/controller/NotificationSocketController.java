package fr.tictak.pulse.controller;

import fr.tictak.pulse.config.webSocket.LiveSessionRegistry;
import fr.tictak.pulse.config.webSocket.SessionMessenger;
import fr.tictak.pulse.dto.out.PushEnvelope;
import fr.tictak.pulse.exception.ApiException;
import fr.tictak.pulse.service.implementation.NotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Client-to-server frames on the live connection. Replies go to the sending session only.
 */
@Controller
@Tag(name = "Flux temps réel", description = "Messages STOMP envoyés par le client sur la connexion temps réel.")
public class NotificationSocketController {

    private static final Logger logger = LoggerFactory.getLogger(NotificationSocketController.class);

    private final LiveSessionRegistry sessionRegistry;
    private final SessionMessenger messenger;
    private final NotificationService notificationService;

    public NotificationSocketController(LiveSessionRegistry sessionRegistry, SessionMessenger messenger,
                                        NotificationService notificationService) {
        this.sessionRegistry = sessionRegistry;
        this.messenger = messenger;
        this.notificationService = notificationService;
    }

    @Operation(summary = "Réponse au heartbeat")
    @MessageMapping("/pong")
    public void pong(SimpMessageHeaderAccessor accessor) {
        sessionRegistry.recordPong(accessor.getSessionId());
    }

    @Operation(summary = "Marquer une notification comme lue depuis la connexion temps réel")
    @MessageMapping("/notifications/{notificationId}/read")
    public void markAsRead(@DestinationVariable String notificationId, SimpMessageHeaderAccessor accessor, Principal principal) {
        String sessionId = accessor.getSessionId();
        LiveSessionRegistry.LiveSession session = sessionRegistry.sessionsOf(principal.getName()).stream()
                .filter(s -> s.getSessionId().equals(sessionId))
                .findFirst()
                .orElse(null);
        if (session == null) {
            logger.warn("Read request from unknown session {}", sessionId);
            return;
        }
        try {
            notificationService.markAsRead(principal.getName(), notificationId);
            messenger.toSession(session, PushEnvelope.notificationRead(notificationId, true));
            messenger.toSession(session, PushEnvelope.unreadCount(notificationService.unreadCount(principal.getName())));
        } catch (ApiException e) {
            logger.info("Read request for notification {} refused: {}", notificationId, e.getMessage());
            messenger.toSession(session, PushEnvelope.notificationRead(notificationId, false));
            messenger.toSession(session, PushEnvelope.error(e.getMessage()));
        }
    }
}
