package fr.tictak.pulse.service.implementation;

import fr.tictak.pulse.dto.in.PreferenceRequest;
import fr.tictak.pulse.dto.in.PreferenceUpdateRequest;
import fr.tictak.pulse.exception.ConflictException;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.DeliveryChannel;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.repository.NotificationPreferenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PreferenceServiceImpl Unit Tests")
class PreferenceServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final String USER = "user-1";

    @Mock
    private NotificationPreferenceRepository preferenceRepository;

    private PreferenceServiceImpl preferenceService;

    @BeforeEach
    void setUp() {
        preferenceService = new PreferenceServiceImpl(preferenceRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should resolve fail-open defaults when nothing is stored")
    void shouldResolveDefaults() {
        // Given
        when(preferenceRepository.findByUserIdAndNotificationType(USER, NotificationType.SYSTEM))
                .thenReturn(Optional.empty());

        // When
        NotificationPreference preference = preferenceService.resolve(USER, NotificationType.SYSTEM);

        // Then
        assertThat(preference.isEnabled()).isTrue();
        assertThat(preference.enabledChannels()).containsExactly(DeliveryChannel.IN_APP);
        verify(preferenceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should create a preference with omitted flags taken from defaults")
    void shouldCreateFromDefaults() {
        // Given
        when(preferenceRepository.existsByUserIdAndNotificationType(USER, NotificationType.ACHIEVEMENT)).thenReturn(false);
        when(preferenceRepository.save(any(NotificationPreference.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationPreference created = preferenceService.create(USER,
                new PreferenceRequest(NotificationType.ACHIEVEMENT, null, null, true, null, null));

        // Then
        assertThat(created.isEnabled()).isTrue();
        assertThat(created.isInAppEnabled()).isTrue();
        assertThat(created.isEmailEnabled()).isTrue();
        assertThat(created.isPushEnabled()).isFalse();
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should reject a second preference for the same type")
    void shouldRejectDuplicate() {
        // Given
        when(preferenceRepository.existsByUserIdAndNotificationType(USER, NotificationType.SYSTEM)).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> preferenceService.create(USER,
                new PreferenceRequest(NotificationType.SYSTEM, false, null, null, null, null)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Should turn a concurrent insert into a conflict")
    void shouldMapDuplicateKeyToConflict() {
        // Given
        when(preferenceRepository.existsByUserIdAndNotificationType(USER, NotificationType.SYSTEM)).thenReturn(false);
        when(preferenceRepository.save(any(NotificationPreference.class))).thenThrow(new DuplicateKeyException("dup"));

        // When / Then
        assertThatThrownBy(() -> preferenceService.create(USER,
                new PreferenceRequest(NotificationType.SYSTEM, null, null, null, null, null)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Should only change the fields present in the patch")
    void shouldMergePatch() {
        // Given
        NotificationPreference stored = NotificationPreference.defaults(USER, NotificationType.TASK_DUE_SOON);
        stored.setPushEnabled(true);
        when(preferenceRepository.findByUserIdAndNotificationType(USER, NotificationType.TASK_DUE_SOON))
                .thenReturn(Optional.of(stored));
        when(preferenceRepository.save(any(NotificationPreference.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationPreference updated = preferenceService.update(USER, NotificationType.TASK_DUE_SOON,
                new PreferenceUpdateRequest(null, false, null, null, null));

        // Then
        assertThat(updated.isInAppEnabled()).isFalse();
        assertThat(updated.isPushEnabled()).isTrue();
        assertThat(updated.isEnabled()).isTrue();
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should create the row from defaults when patching an unknown type")
    void shouldUpsertOnPatch() {
        // Given
        when(preferenceRepository.findByUserIdAndNotificationType(USER, NotificationType.CAPACITY_OVERLOAD))
                .thenReturn(Optional.empty());
        when(preferenceRepository.save(any(NotificationPreference.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        NotificationPreference updated = preferenceService.update(USER, NotificationType.CAPACITY_OVERLOAD,
                new PreferenceUpdateRequest(false, null, null, null, null));

        // Then
        assertThat(updated.isEnabled()).isFalse();
        assertThat(updated.isInAppEnabled()).isTrue();
        assertThat(updated.getCreatedAt()).isEqualTo(NOW);
        assertThat(updated.enabledChannels()).isEmpty();
    }

    @Test
    @DisplayName("Should fail to delete a preference that was never stored")
    void shouldFailDeleteWhenAbsent() {
        // Given
        when(preferenceRepository.findByUserIdAndNotificationType(USER, NotificationType.SYSTEM))
                .thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> preferenceService.delete(USER, NotificationType.SYSTEM))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
