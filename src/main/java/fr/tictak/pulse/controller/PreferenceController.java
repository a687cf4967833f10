package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.in.PreferenceRequest;
import fr.tictak.pulse.dto.in.PreferenceUpdateRequest;
import fr.tictak.pulse.model.NotificationPreference;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.service.PreferenceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notification-preferences")
@Tag(name = "Préférences de notification", description = "Activation des types de notification et des canaux de livraison par utilisateur.")
public class PreferenceController {

    private final PreferenceService preferenceService;

    public PreferenceController(PreferenceService preferenceService) {
        this.preferenceService = preferenceService;
    }

    @GetMapping
    @Operation(summary = "Lister les préférences enregistrées", description = "Un type sans préférence enregistrée est actif, en application uniquement.")
    public ResponseEntity<List<NotificationPreference>> list(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(preferenceService.list(userId));
    }

    @GetMapping("/{type}")
    @Operation(summary = "Récupérer la préférence d'un type")
    public ResponseEntity<NotificationPreference> get(@PathVariable NotificationType type, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(preferenceService.get(userId, type));
    }

    @PostMapping
    @Operation(summary = "Créer une préférence")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Préférence créée"),
            @ApiResponse(responseCode = "409", description = "Une préférence existe déjà pour ce type")
    })
    public ResponseEntity<NotificationPreference> create(@Valid @RequestBody PreferenceRequest request,
                                                         @AuthenticationPrincipal String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(preferenceService.create(userId, request));
    }

    @PatchMapping("/{type}")
    @Operation(summary = "Modifier une préférence", description = "Mise à jour partielle : seuls les champs fournis sont modifiés. La préférence est créée si elle n'existe pas.")
    public ResponseEntity<NotificationPreference> update(@PathVariable NotificationType type,
                                                         @RequestBody PreferenceUpdateRequest request,
                                                         @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(preferenceService.update(userId, type, request));
    }

    @DeleteMapping("/{type}")
    @Operation(summary = "Supprimer une préférence", description = "Le type revient au comportement par défaut.")
    public ResponseEntity<Void> delete(@PathVariable NotificationType type, @AuthenticationPrincipal String userId) {
        preferenceService.delete(userId, type);
        return ResponseEntity.noContent().build();
    }
}
