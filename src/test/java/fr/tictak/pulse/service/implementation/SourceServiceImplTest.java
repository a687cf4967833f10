package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.concurrent.BoundedWorkerPool;
import fr.tictak.pulse.config.PulseProperties;
import fr.tictak.pulse.dto.in.SourceRequest;
import fr.tictak.pulse.dto.out.AuthTestResult;
import fr.tictak.pulse.dto.out.DispatchResult;
import fr.tictak.pulse.dto.out.SyncResult;
import fr.tictak.pulse.exception.BadRequestException;
import fr.tictak.pulse.exception.TooManyRequestsException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.NotificationSource;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.model.enums.SourceType;
import fr.tictak.pulse.repository.NotificationSourceRepository;
import fr.tictak.pulse.service.dispatch.DeliveryDispatcher;
import fr.tictak.pulse.service.source.CollectedItem;
import fr.tictak.pulse.service.source.SourceConnector;
import fr.tictak.pulse.service.source.SourceConnectorException;
import fr.tictak.pulse.service.source.SourceConnectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SourceServiceImpl Unit Tests")
class SourceServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final String USER = "user-1";

    @Mock
    private NotificationSourceRepository sourceRepository;

    @Mock
    private SourceConnectorRegistry connectorRegistry;

    @Mock
    private DeliveryDispatcher dispatcher;

    @Mock
    private SourceConnector connector;

    private BoundedWorkerPool workerPool;
    private SourceServiceImpl sourceService;

    @BeforeEach
    void setUp() {
        PulseProperties properties = new PulseProperties();
        properties.getSources().setSyncLimitPerHour(2);
        workerPool = new BoundedWorkerPool("test-batch", 2);
        sourceService = new SourceServiceImpl(sourceRepository, connectorRegistry, dispatcher, workerPool, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        workerPool.close();
    }

    private static NotificationSource source(String id, SourceType type) {
        NotificationSource source = new NotificationSource();
        source.setId(id);
        source.setUserId(USER);
        source.setSourceType(type);
        source.setName("My " + type.getValue());
        return source;
    }

    @Test
    @DisplayName("Should require a source type and a name on creation")
    void shouldValidateCreate() {
        // When / Then
        assertThatThrownBy(() -> sourceService.create(USER, new SourceRequest(null, "x", null, null, null, null)))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("sourceType is required");
        assertThatThrownBy(() -> sourceService.create(USER, new SourceRequest(SourceType.SLACK, " ", null, null, null, null)))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("name is required");
    }

    @Test
    @DisplayName("Should dispatch each collected item as a source notification and record the sync")
    void shouldCollectAndDispatch() throws Exception {
        // Given
        NotificationSource source = source("s-1", SourceType.GITHUB);
        source.setTotalCollected(4);
        when(sourceRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(source));
        when(connectorRegistry.find(SourceType.GITHUB)).thenReturn(Optional.of(connector));
        when(connector.collect(source, null)).thenReturn(List.of(
                new CollectedItem("PR merged", "#42 was merged", Map.of("repo", "pulse")),
                new CollectedItem("Issue opened", "#43 needs triage", null)));
        when(dispatcher.dispatch(any(Notification.class))).thenReturn(DispatchResult.suppressed(null, null, List.of()));
        ArgumentCaptor<Notification> dispatched = ArgumentCaptor.forClass(Notification.class);

        // When
        SyncResult result = sourceService.triggerCollection(USER, "s-1");

        // Then
        assertThat(result.success()).isTrue();
        assertThat(result.collected()).isEqualTo(2);
        verify(dispatcher, times(2)).dispatch(dispatched.capture());
        Notification first = dispatched.getAllValues().get(0);
        assertThat(first.getType()).isEqualTo(NotificationType.SOURCE_ITEM_READY);
        assertThat(first.getSourceId()).isEqualTo("s-1");
        assertThat(first.getMetadata())
                .containsEntry("source_id", "s-1")
                .containsEntry("source_type", "github")
                .containsEntry("repo", "pulse");
        assertThat(source.getLastSync()).isEqualTo(NOW);
        assertThat(source.getLastError()).isNull();
        assertThat(source.getTotalCollected()).isEqualTo(6);
        verify(sourceRepository).save(source);
    }

    @Test
    @DisplayName("Should report a missing connector as a failed result, not an exception")
    void shouldReportMissingConnector() {
        // Given
        NotificationSource source = source("s-1", SourceType.TRELLO);
        when(sourceRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(source));
        when(connectorRegistry.find(SourceType.TRELLO)).thenReturn(Optional.empty());

        // When
        SyncResult result = sourceService.triggerCollection(USER, "s-1");

        // Then
        assertThat(result.success()).isFalse();
        assertThat(result.errors()).containsExactly("No connector registered for trello");
        assertThat(source.getLastError()).isEqualTo("No connector registered for trello");
        verify(dispatcher, never()).dispatch(any(Notification.class));
    }

    @Test
    @DisplayName("Should record the connector error on a failed collection")
    void shouldRecordConnectorFailure() throws Exception {
        // Given
        NotificationSource source = source("s-1", SourceType.SLACK);
        when(sourceRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(source));
        when(connectorRegistry.find(SourceType.SLACK)).thenReturn(Optional.of(connector));
        when(connector.collect(source, null)).thenThrow(new SourceConnectorException("token revoked"));

        // When
        SyncResult result = sourceService.triggerCollection(USER, "s-1");

        // Then
        assertThat(result).isEqualTo(SyncResult.failed("s-1", "token revoked"));
        assertThat(source.getLastError()).isEqualTo("token revoked");
        assertThat(source.getLastSync()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should refuse manual syncs beyond the hourly limit")
    void shouldRateLimitManualSync() {
        // Given
        NotificationSource source = source("s-1", SourceType.NOTION);
        when(sourceRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(source));
        when(connectorRegistry.find(SourceType.NOTION)).thenReturn(Optional.empty());
        sourceService.triggerCollection(USER, "s-1");
        sourceService.triggerCollection(USER, "s-1");

        // When / Then
        assertThatThrownBy(() -> sourceService.triggerCollection(USER, "s-1"))
                .isInstanceOf(TooManyRequestsException.class);
    }

    @Test
    @DisplayName("Should report auth test outcomes from the connector")
    void shouldTestAuthentication() throws Exception {
        // Given
        NotificationSource source = source("s-1", SourceType.DISCORD);
        when(sourceRepository.findByIdAndUserId("s-1", USER)).thenReturn(Optional.of(source));
        when(connectorRegistry.find(SourceType.DISCORD)).thenReturn(Optional.of(connector));
        when(connector.testAuthentication(source)).thenThrow(new SourceConnectorException("invalid bot token"));

        // When
        AuthTestResult result = sourceService.testAuth(USER, "s-1");

        // Then
        assertThat(result).isEqualTo(AuthTestResult.failed("invalid bot token"));
    }

    @Test
    @DisplayName("Should collect only enabled sources whose sync interval elapsed")
    void shouldCollectDueSources() {
        // Given
        NotificationSource neverSynced = source("s-1", SourceType.EMAIL);
        NotificationSource recent = source("s-2", SourceType.EMAIL);
        recent.setLastSync(NOW.minus(Duration.ofMinutes(5)));
        NotificationSource overdue = source("s-3", SourceType.EMAIL);
        overdue.setLastSync(NOW.minus(Duration.ofMinutes(15)));
        when(sourceRepository.findByEnabledIsTrue()).thenReturn(List.of(neverSynced, recent, overdue));
        when(connectorRegistry.find(SourceType.EMAIL)).thenReturn(Optional.empty());

        // When
        int collected = sourceService.collectDueSources(NOW);

        // Then
        assertThat(collected).isEqualTo(2);
        assertThat(recent.getLastSync()).isEqualTo(NOW.minus(Duration.ofMinutes(5)));
        assertThat(neverSynced.getLastSync()).isEqualTo(NOW);
        assertThat(overdue.getLastSync()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should sync every enabled source of the user and keep results in order")
    void shouldSyncAll() {
        // Given
        List<NotificationSource> sources = List.of(source("s-1", SourceType.TELEGRAM), source("s-2", SourceType.WHATSAPP));
        when(sourceRepository.findByUserIdAndEnabledIsTrue(USER)).thenReturn(sources);
        when(connectorRegistry.find(any(SourceType.class))).thenReturn(Optional.empty());

        // When
        List<SyncResult> results = sourceService.syncAll(USER);

        // Then
        assertThat(results).extracting(SyncResult::sourceId).containsExactly("s-1", "s-2");
        assertThat(results).noneMatch(SyncResult::success);
    }
}
