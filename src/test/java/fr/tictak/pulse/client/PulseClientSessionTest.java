package fr.tictak.pulse.client;

import fr.tictak.pulse.client.api.NotificationApiClient;
import fr.tictak.pulse.client.connection.ConnectionState;
import fr.tictak.pulse.client.connection.StompTransport;
import fr.tictak.pulse.client.connection.TokenProvider;
import fr.tictak.pulse.client.platform.PlatformNotifications;
import fr.tictak.pulse.client.resilience.ErrorClassifier;
import fr.tictak.pulse.client.resilience.OfflineQueue;
import fr.tictak.pulse.client.resilience.OfflineQueueEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PulseClientSession")
class PulseClientSessionTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Mock
    private TokenProvider tokenProvider;

    @Mock
    private PlatformNotifications platform;

    @Mock
    private NotificationApiClient api;

    private final RecordingTransport transport = new RecordingTransport();
    private PulseClientProperties properties;

    @BeforeEach
    void setUp() {
        properties = new PulseClientProperties();
        properties.setOfflineQueueFile(dir.resolve("offline-queue.json"));
        properties.setIoThreads(1);
    }

    @Test
    @DisplayName("Should not connect nor replay without a token")
    void shouldNotOpenWithoutToken() {
        // Given
        when(tokenProvider.currentToken()).thenReturn(Optional.empty());

        try (PulseClientSession session = new PulseClientSession(properties, tokenProvider, platform, transport, api,
                CLOCK)) {
            // When
            boolean opened = session.open();

            // Then
            assertThat(opened).isFalse();
            assertThat(session.connection().state()).isEqualTo(ConnectionState.CLOSED);
            assertThat(transport.tokens).isEmpty();
        }
        verifyNoInteractions(api);
    }

    @Test
    @DisplayName("Should connect and replay requests queued by a previous run")
    void shouldReplayQueueLeftByPreviousRun() throws Exception {
        // Given
        new OfflineQueue(properties.getOfflineQueueFile(), 5, new ErrorClassifier(), CLOCK)
                .enqueue("PATCH", NotificationApiClient.readEndpoint("n-1"), null);
        when(tokenProvider.currentToken()).thenReturn(Optional.of("token-1"));

        try (PulseClientSession session = new PulseClientSession(properties, tokenProvider, platform, transport, api,
                CLOCK)) {
            // When
            boolean opened = session.open();

            // Then
            assertThat(opened).isTrue();
            assertThat(transport.tokens).containsExactly("token-1");
            ArgumentCaptor<OfflineQueueEntry> replayed = ArgumentCaptor.forClass(OfflineQueueEntry.class);
            verify(api, timeout(2000)).replay(replayed.capture());
            assertThat(replayed.getValue().endpoint()).isEqualTo("/api/notifications/n-1/read");
            OfflineQueue.ReplayReport again = session.replayOfflineQueue().get();
            assertThat(again.remaining()).isZero();
        }
    }

    @Test
    @DisplayName("Should report the queue untouched once closed")
    void shouldSkipReplayAfterClose() throws Exception {
        // Given
        PulseClientSession session = new PulseClientSession(properties, tokenProvider, platform, transport, api, CLOCK);
        session.offlineQueue().enqueue("DELETE", NotificationApiClient.deleteEndpoint("n-2"), null);

        // When
        session.close();
        OfflineQueue.ReplayReport report = session.replayOfflineQueue().get();

        // Then
        assertThat(report.replayed()).isZero();
        assertThat(report.remaining()).isEqualTo(1);
        assertThat(transport.disconnects).isPositive();
        verifyNoInteractions(api);
    }

    private static final class RecordingTransport implements StompTransport {
        final List<String> tokens = new CopyOnWriteArrayList<>();
        volatile int disconnects;

        @Override
        public void connect(String token, Listener listener) {
            tokens.add(token);
        }

        @Override
        public boolean send(String destination, Object payload) {
            return false;
        }

        @Override
        public void disconnect() {
            disconnects++;
        }
    }
}
