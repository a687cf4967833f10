package fr.tictak.pulse.client.resilience;

import fr.tictak.pulse.client.ErrorKind;
import fr.tictak.pulse.client.PulseClientException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.ConnectException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("OfflineQueue")
class OfflineQueueTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path file;
    private OfflineQueue queue;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("queue").resolve("offline-queue.json");
        queue = new OfflineQueue(file, 3, new ErrorClassifier(), CLOCK);
    }

    @Test
    @DisplayName("Should persist entries in enqueue order and reload them")
    void shouldPersistAndReload() {
        // Given
        queue.enqueue("PATCH", "/api/notifications/n-1/read", null);
        queue.enqueue("PATCH", "/api/notification-preferences/system", Map.of("enabled", false));

        // When
        OfflineQueue reopened = new OfflineQueue(file, 3, new ErrorClassifier(), CLOCK);

        // Then
        assertThat(Files.exists(file)).isTrue();
        assertThat(reopened.entries()).extracting(OfflineQueueEntry::endpoint)
                .containsExactly("/api/notifications/n-1/read", "/api/notification-preferences/system");
        assertThat(reopened.entries().get(1).payload().get("enabled").asBoolean()).isFalse();
        assertThat(reopened.entries().get(0).enqueuedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Should leave memory and file unchanged when the queue cannot be written")
    void shouldNotKeepUnpersistedEntry() throws Exception {
        // Given
        queue.enqueue("PATCH", "/api/notifications/n-1/read", null);
        Path blocked = Files.createDirectory(file.resolveSibling(file.getFileName() + ".tmp"));

        // When
        Throwable error = catchThrowable(() -> queue.enqueue("DELETE", "/api/notifications/n-2", null));

        // Then
        assertThat(error).isInstanceOf(PulseClientException.class);
        assertThat(queue.entries()).extracting(OfflineQueueEntry::endpoint)
                .containsExactly("/api/notifications/n-1/read");
        assertThat(new OfflineQueue(file, 3, new ErrorClassifier(), CLOCK).size()).isEqualTo(1);

        Files.delete(blocked);
        queue.enqueue("DELETE", "/api/notifications/n-2", null);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should replay in order and empty the queue on success")
    void shouldReplayInOrder() {
        // Given
        queue.enqueue("PATCH", "/a", null);
        queue.enqueue("DELETE", "/b", null);
        List<String> sent = new ArrayList<>();

        // When
        OfflineQueue.ReplayReport report = queue.replay(entry -> sent.add(entry.endpoint()));

        // Then
        assertThat(sent).containsExactly("/a", "/b");
        assertThat(report.replayed()).isEqualTo(2);
        assertThat(report.remaining()).isZero();
        assertThat(new OfflineQueue(file, 3, new ErrorClassifier(), CLOCK).size()).isZero();
    }

    @Test
    @DisplayName("Should pause on a transient failure and keep the entry with one more attempt")
    void shouldPauseOnTransientFailure() {
        // Given
        queue.enqueue("PATCH", "/a", null);
        queue.enqueue("PATCH", "/b", null);
        List<String> sent = new ArrayList<>();

        // When
        OfflineQueue.ReplayReport report = queue.replay(entry -> {
            sent.add(entry.endpoint());
            throw new ConnectException("still offline");
        });

        // Then
        assertThat(sent).containsExactly("/a");
        assertThat(report.stoppedOnTransient()).isTrue();
        assertThat(queue.entries()).extracting(OfflineQueueEntry::attempts).containsExactly(1, 0);
    }

    @Test
    @DisplayName("Should drop and report a permanently rejected entry, then continue")
    void shouldDropPermanentFailures() {
        // Given
        queue.enqueue("PATCH", "/gone", null);
        queue.enqueue("PATCH", "/ok", null);
        List<OfflineQueue.PermanentFailure> failures = new ArrayList<>();
        queue.addPermanentFailureListener(failures::add);

        // When
        OfflineQueue.ReplayReport report = queue.replay(entry -> {
            if (entry.endpoint().equals("/gone")) {
                throw new PulseClientException(ErrorKind.NOT_FOUND, "notification deleted");
            }
        });

        // Then
        assertThat(report.replayed()).isEqualTo(1);
        assertThat(report.dropped()).isEqualTo(1);
        assertThat(failures).extracting(f -> f.entry().endpoint()).containsExactly("/gone");
        assertThat(queue.size()).isZero();
    }

    @Test
    @DisplayName("Should drop an entry that keeps failing transiently past the attempt ceiling")
    void shouldDropAtAttemptCeiling() {
        // Given
        queue.enqueue("POST", "/api/notifications/read-all", null);
        List<OfflineQueue.PermanentFailure> failures = new ArrayList<>();
        queue.addPermanentFailureListener(failures::add);

        // When
        for (int i = 0; i < 3; i++) {
            queue.replay(entry -> {
                throw new ConnectException("still offline");
            });
        }

        // Then
        assertThat(queue.size()).isZero();
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).entry().attempts()).isEqualTo(3);
    }
}
