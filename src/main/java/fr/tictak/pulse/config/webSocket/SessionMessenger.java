package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.dto.out.PushEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.converter.MessageConverter;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.MimeTypeUtils;

/**
 * Sends envelopes to live sessions. Per-session frames (greeting, heartbeat, direct replies) go straight to the
 * outbound channel on the session's subscription, so they never depend on the broker having registered the
 * subscription yet. Per-user frames go through the user destination and reach every session of the user.
 */
@Slf4j
@Component
public class SessionMessenger {

    public static final String USER_QUEUE = "/queue/notifications";
    public static final String SUBSCRIBED_DESTINATION = "/user" + USER_QUEUE;

    private final MessageChannel clientOutboundChannel;
    private final MessageConverter messageConverter;
    private final SimpMessagingTemplate messagingTemplate;

    public SessionMessenger(@Qualifier("clientOutboundChannel") MessageChannel clientOutboundChannel,
                            @Qualifier("brokerMessageConverter") MessageConverter messageConverter,
                            SimpMessagingTemplate messagingTemplate) {
        this.clientOutboundChannel = clientOutboundChannel;
        this.messageConverter = messageConverter;
        this.messagingTemplate = messagingTemplate;
    }

    public void toUser(String userId, PushEnvelope envelope) {
        messagingTemplate.convertAndSendToUser(userId, USER_QUEUE, envelope);
        log.debug("Pushed {} to user {}", envelope.type(), userId);
    }

    public boolean toSession(LiveSessionRegistry.LiveSession session, PushEnvelope envelope) {
        if (session.getSubscriptionId() == null) {
            return false;
        }
        return toSession(session.getSessionId(), session.getSubscriptionId(), envelope);
    }

    public boolean toSession(String sessionId, String subscriptionId, PushEnvelope envelope) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setSubscriptionId(subscriptionId);
        accessor.setDestination(SUBSCRIBED_DESTINATION);
        accessor.setContentType(MimeTypeUtils.APPLICATION_JSON);
        accessor.setLeaveMutable(true);
        Message<?> message = messageConverter.toMessage(envelope, accessor.getMessageHeaders());
        if (message == null) {
            log.warn("Could not convert {} frame for session {}", envelope.type(), sessionId);
            return false;
        }
        boolean sent = clientOutboundChannel.send(message);
        log.debug("Sent {} to session {}: {}", envelope.type(), sessionId, sent);
        return sent;
    }
}
