package fr.tictak.pulse.interceptor;

import com.sun.security.auth.UserPrincipal;
import fr.tictak.pulse.security.JwtUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Authenticates the STOMP CONNECT frame from its {@code Authorization: Bearer <jwt>} native header.
 * The principal name is the user id, so user destinations resolve per user.
 */
@Component
public class AuthenticationInterceptor implements ChannelInterceptor {

    public static final String USER_ID_ATTRIBUTE = "userId";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationInterceptor.class);

    private final JwtUtils jwtUtils;

    public AuthenticationInterceptor(JwtUtils jwtUtils) {
        this.jwtUtils = jwtUtils;
    }

    @Override
    public Message<?> preSend(@NotNull Message<?> message, @NotNull MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }

        String token = JwtUtils.stripBearer(accessor.getFirstNativeHeader(JwtUtils.HEADER_AUTH));
        if (token == null) {
            log.debug("CONNECT rejected: no bearer token (session {})", accessor.getSessionId());
            throw new StompAuthenticationException(message, "missing bearer token");
        }
        if (!jwtUtils.validateToken(token)) {
            log.info("CONNECT rejected: invalid or expired token (session {})", accessor.getSessionId());
            throw new StompAuthenticationException(message, "invalid or expired token");
        }

        String userId = jwtUtils.getUserIdFromToken(token);
        Map<String, Object> sessionAttributes = accessor.getSessionAttributes();
        if (sessionAttributes != null) {
            sessionAttributes.put(USER_ID_ATTRIBUTE, userId);
        }
        accessor.setUser(new UserPrincipal(userId));
        log.debug("CONNECT authenticated for userId {} (session {})", userId, accessor.getSessionId());
        return message;
    }
}
