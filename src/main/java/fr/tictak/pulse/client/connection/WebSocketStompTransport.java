package fr.tictak.pulse.client.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.PulseClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.stomp.ConnectionLostException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;

/**
 * STOMP over a plain WebSocket. Frames are exchanged as raw JSON bytes and decoded by the connection manager.
 */
public class WebSocketStompTransport implements StompTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketStompTransport.class);

    public static final String SUBSCRIPTION = "/user/queue/notifications";
    static final String AUTH_ERROR_PREFIX = "AUTH:";

    private final String url;
    private final WebSocketStompClient stompClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private volatile StompSession session;

    public WebSocketStompTransport(String url) {
        this.url = url;
        this.stompClient = new WebSocketStompClient(new StandardWebSocketClient());
    }

    @Override
    public void connect(String token, Listener listener) {
        StompHeaders connectHeaders = new StompHeaders();
        connectHeaders.add("Authorization", "Bearer " + token);
        stompClient.connectAsync(url, new WebSocketHttpHeaders(), connectHeaders, new SessionHandler(listener))
                .whenComplete((connected, error) -> {
                    if (error != null) {
                        log.debug("STOMP connect to {} failed: {}", url, error.getMessage());
                        listener.onError(error);
                    }
                });
    }

    @Override
    public boolean send(String destination, Object payload) {
        StompSession current = session;
        if (current == null || !current.isConnected()) {
            return false;
        }
        try {
            StompHeaders headers = new StompHeaders();
            headers.setDestination(destination);
            headers.setContentType(MimeTypeUtils.APPLICATION_JSON);
            current.send(headers, mapper.writeValueAsBytes(payload));
            return true;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Could not send to {}: {}", destination, e.getMessage());
            return false;
        }
    }

    @Override
    public void disconnect() {
        StompSession current = session;
        session = null;
        if (current != null && current.isConnected()) {
            try {
                current.disconnect();
            } catch (RuntimeException e) {
                log.debug("Disconnect failed: {}", e.getMessage());
            }
        }
    }

    private final class SessionHandler extends StompSessionHandlerAdapter {

        private final Listener listener;

        SessionHandler(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnected(StompSession stompSession, StompHeaders connectedHeaders) {
            session = stompSession;
            stompSession.subscribe(SUBSCRIPTION, new StompFrameHandler() {
                @Override
                public Type getPayloadType(StompHeaders headers) {
                    return byte[].class;
                }

                @Override
                public void handleFrame(StompHeaders headers, Object payload) {
                    listener.onFrame(new String((byte[]) payload, StandardCharsets.UTF_8));
                }
            });
            listener.onOpen();
        }

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return byte[].class;
        }

        /**
         * Only ERROR frames reach the session handler.
         */
        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            String message = headers.getFirst("message");
            if (message != null && message.startsWith(AUTH_ERROR_PREFIX)) {
                listener.onError(new PulseClientException(ErrorKind.AUTH, message.substring(AUTH_ERROR_PREFIX.length()).trim()));
            } else {
                listener.onError(new PulseClientException(ErrorKind.TRANSIENT, "STOMP error: " + message));
            }
        }

        @Override
        public void handleException(StompSession stompSession, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.warn("Error handling {} frame: {}", command, exception.getMessage());
        }

        @Override
        public void handleTransportError(StompSession stompSession, Throwable exception) {
            if (session == stompSession) {
                session = null;
            }
            if (exception instanceof ConnectionLostException) {
                listener.onClose();
            } else {
                listener.onError(exception);
            }
        }
    }
}
