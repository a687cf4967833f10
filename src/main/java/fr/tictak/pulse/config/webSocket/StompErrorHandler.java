package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.interceptor.StompAuthenticationException;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.StompSubProtocolErrorHandler;

import java.nio.charset.StandardCharsets;

/**
 * Turns authentication failures into ERROR frames whose message starts with {@code AUTH:} so clients can tell
 * them apart from transport errors.
 */
@Component
public class StompErrorHandler extends StompSubProtocolErrorHandler {

    @Override
    public Message<byte[]> handleClientMessageProcessingError(Message<byte[]> clientMessage, Throwable ex) {
        StompAuthenticationException authFailure = findAuthFailure(ex);
        if (authFailure == null) {
            return super.handleClientMessageProcessingError(clientMessage, ex);
        }
        String text = StompAuthenticationException.ERROR_PREFIX + authFailure.getReason();
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.ERROR);
        accessor.setMessage(text);
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(text.getBytes(StandardCharsets.UTF_8), accessor.getMessageHeaders());
    }

    private static StompAuthenticationException findAuthFailure(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof StompAuthenticationException auth) {
                return auth;
            }
            current = current.getCause();
        }
        return null;
    }
}
