package fr.tictak.pulse.interceptor;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

import java.security.Principal;

@Component
@Tag(name = "Intercepteur d'abonnement WebSocket", description = "Sécurise les abonnements STOMP : seul un utilisateur authentifié peut s'abonner, et uniquement à ses propres files /user/queue/**.")
public class SubscriptionInterceptor implements ChannelInterceptor {

    public static final String USER_QUEUE_PREFIX = "/user/queue/";

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionInterceptor.class);

    @Override
    public Message<?> preSend(@NotNull Message<?> message, @NotNull MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.SUBSCRIBE.equals(accessor.getCommand())) {
            return message;
        }
        String destination = accessor.getDestination();
        Principal principal = accessor.getUser();
        if (principal == null) {
            logger.warn("Subscription to {} refused: unauthenticated session {}", destination, accessor.getSessionId());
            throw new AccessDeniedException("Not authenticated");
        }
        // other users' resolved queues (/queue/...-user<session>) and shared topics are off limits
        if (destination == null || !destination.startsWith(USER_QUEUE_PREFIX)) {
            logger.warn("Subscription to {} refused for user {}", destination, principal.getName());
            throw new AccessDeniedException("Not allowed to subscribe to " + destination);
        }
        logger.debug("Subscription to {} accepted for user {}", destination, principal.getName());
        return message;
    }
}
