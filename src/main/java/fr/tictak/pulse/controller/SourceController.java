package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.in.SourceRequest;
import fr.tictak.pulse.dto.out.AuthTestResult;
import fr.tictak.pulse.dto.out.SyncResult;
import fr.tictak.pulse.model.NotificationSource;
import fr.tictak.pulse.service.SourceService;
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
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notification-sources")
@Tag(name = "Sources externes", description = "Connexion de plateformes externes dont les éléments deviennent des notifications.")
public class SourceController {

    private final SourceService sourceService;

    public SourceController(SourceService sourceService) {
        this.sourceService = sourceService;
    }

    @GetMapping
    @Operation(summary = "Lister les sources", description = "Les identifiants de connexion ne sont jamais renvoyés.")
    public ResponseEntity<List<NotificationSource>> list(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.list(userId));
    }

    @GetMapping("/{sourceId}")
    public ResponseEntity<NotificationSource> get(@PathVariable String sourceId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.get(userId, sourceId));
    }

    @PostMapping
    @Operation(summary = "Ajouter une source")
    public ResponseEntity<NotificationSource> create(@Valid @RequestBody SourceRequest request,
                                                     @AuthenticationPrincipal String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sourceService.create(userId, request));
    }

    @PutMapping("/{sourceId}")
    @Operation(summary = "Modifier une source")
    public ResponseEntity<NotificationSource> update(@PathVariable String sourceId, @Valid @RequestBody SourceRequest request,
                                                     @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.update(userId, sourceId, request));
    }

    @DeleteMapping("/{sourceId}")
    public ResponseEntity<Void> delete(@PathVariable String sourceId, @AuthenticationPrincipal String userId) {
        sourceService.delete(userId, sourceId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sourceId}/test-auth")
    @Operation(summary = "Tester les identifiants d'une source")
    public ResponseEntity<AuthTestResult> testAuth(@PathVariable String sourceId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.testAuth(userId, sourceId));
    }

    @PostMapping("/{sourceId}/sync")
    @Operation(summary = "Lancer une collecte manuelle")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Collecte terminée, voir le détail des erreurs éventuelles"),
            @ApiResponse(responseCode = "429", description = "Trop de collectes manuelles sur l'heure écoulée")
    })
    public ResponseEntity<SyncResult> sync(@PathVariable String sourceId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.triggerCollection(userId, sourceId));
    }

    @PostMapping("/sync-all")
    @Operation(summary = "Collecter toutes les sources actives")
    public ResponseEntity<List<SyncResult>> syncAll(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(sourceService.syncAll(userId));
    }
}
