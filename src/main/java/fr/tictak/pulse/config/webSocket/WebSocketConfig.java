package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.interceptor.AuthenticationInterceptor;
import fr.tictak.pulse.interceptor.SubscriptionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketTransportRegistration;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final PulseProperties properties;
    private final AuthenticationInterceptor authenticationInterceptor;
    private final SubscriptionInterceptor subscriptionInterceptor;
    private final StompErrorHandler stompErrorHandler;
    private final LiveSessionRegistry liveSessionRegistry;

    public WebSocketConfig(PulseProperties properties,
                           AuthenticationInterceptor authenticationInterceptor,
                           SubscriptionInterceptor subscriptionInterceptor,
                           StompErrorHandler stompErrorHandler,
                           LiveSessionRegistry liveSessionRegistry) {
        this.properties = properties;
        this.authenticationInterceptor = authenticationInterceptor;
        this.subscriptionInterceptor = subscriptionInterceptor;
        this.stompErrorHandler = stompErrorHandler;
        this.liveSessionRegistry = liveSessionRegistry;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(properties.getWebsocket().getEndpoint())
                .setAllowedOriginPatterns(properties.getWebsocket().getAllowedOrigins().toArray(new String[0]));
        registry.setErrorHandler(stompErrorHandler);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue");
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
        registry.setPreservePublishOrder(true);
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(authenticationInterceptor, subscriptionInterceptor);
    }

    /**
     * Bounded send time and buffer per session: a slow consumer is dropped instead of stalling the fan-out.
     */
    @Override
    public void configureWebSocketTransport(WebSocketTransportRegistration registration) {
        registration.setSendTimeLimit((int) properties.getWebsocket().getSendTimeLimit().toMillis());
        registration.setSendBufferSizeLimit(properties.getWebsocket().getSendBufferSizeLimit());
        registration.addDecoratorFactory(liveSessionRegistry::decorate);
    }
}
