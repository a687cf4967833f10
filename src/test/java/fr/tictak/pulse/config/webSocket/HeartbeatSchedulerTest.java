package fr.tictak.pulse.config.webSocket;

import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.out.PushEnvelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("HeartbeatScheduler")
class HeartbeatSchedulerTest {

    private static final Instant OPENED = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private SessionMessenger messenger;

    private LiveSessionRegistry registry;
    private PulseProperties properties;

    @BeforeEach
    void setUp() {
        registry = new LiveSessionRegistry(Clock.fixed(OPENED, ZoneOffset.UTC));
        properties = new PulseProperties();
        properties.getWebsocket().setPongTolerance(Duration.ofSeconds(75));
    }

    private HeartbeatScheduler schedulerAt(Instant now) {
        return new HeartbeatScheduler(registry, messenger, properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should send a heartbeat to every live session")
    void shouldBeatLiveSessions() {
        // Given
        registry.register("s-1", "user-1");
        registry.register("s-2", "user-2");
        when(messenger.toSession(any(LiveSessionRegistry.LiveSession.class), any(PushEnvelope.class))).thenReturn(true);

        // When
        schedulerAt(OPENED.plusSeconds(30)).beat();

        // Then
        verify(messenger).toSession(argThat((LiveSessionRegistry.LiveSession s) -> s.getSessionId().equals("s-1")), any(PushEnvelope.class));
        verify(messenger).toSession(argThat((LiveSessionRegistry.LiveSession s) -> s.getSessionId().equals("s-2")), any(PushEnvelope.class));
        assertThat(registry.all()).hasSize(2);
    }

    @Test
    @DisplayName("Should drop sessions that stopped answering pongs")
    void shouldCloseStaleSessions() {
        // Given
        registry.register("s-1", "user-1");

        // When
        schedulerAt(OPENED.plusSeconds(120)).beat();

        // Then
        assertThat(registry.all()).isEmpty();
        verify(messenger, never()).toSession(any(LiveSessionRegistry.LiveSession.class), any(PushEnvelope.class));
    }
}
