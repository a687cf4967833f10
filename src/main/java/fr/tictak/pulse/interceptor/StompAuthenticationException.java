package fr.tictak.pulse.interceptor;

import org.springframework.messaging.Message;
import org.springframework.messaging.MessagingException;

/**
 * A STOMP CONNECT without a usable bearer token. Rendered as an ERROR frame prefixed with {@code AUTH:}.
 */
public class StompAuthenticationException extends MessagingException {

    public static final String ERROR_PREFIX = "AUTH: ";

    private final String reason;

    public StompAuthenticationException(Message<?> message, String reason) {
        super(message, reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
