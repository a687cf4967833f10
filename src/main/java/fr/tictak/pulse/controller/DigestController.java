package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.out.PendingDigestResult;
import fr.tictak.pulse.exception.ResourceNotFoundException;
import fr.tictak.pulse.model.NotificationDigest;
import fr.tictak.pulse.model.enums.DigestType;
import fr.tictak.pulse.service.DigestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/notification-digests")
@Tag(name = "Résumés", description = "Résumés quotidiens, hebdomadaires et mensuels des notifications.")
public class DigestController {

    private final DigestService digestService;

    public DigestController(DigestService digestService) {
        this.digestService = digestService;
    }

    @GetMapping
    @Operation(summary = "Lister les résumés", description = "Du plus récent au plus ancien, avec filtre optionnel sur le type.")
    public ResponseEntity<List<NotificationDigest>> list(@RequestParam(required = false) DigestType type,
                                                         @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(digestService.list(userId, type));
    }

    @GetMapping("/{digestId}")
    public ResponseEntity<NotificationDigest> get(@PathVariable String digestId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(digestService.get(userId, digestId));
    }

    @GetMapping("/latest/{type}")
    @Operation(summary = "Dernier résumé d'un type")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dernier résumé trouvé"),
            @ApiResponse(responseCode = "404", description = "Aucun résumé généré pour ce type")
    })
    public ResponseEntity<NotificationDigest> latest(@PathVariable DigestType type, @AuthenticationPrincipal String userId) {
        return digestService.getLatest(userId, type)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No " + type.getValue() + " digest found"));
    }

    @PostMapping("/generate")
    @Operation(
            summary = "Générer un résumé",
            description = "Sans bornes, la fenêtre par défaut du type est utilisée (se terminant aujourd'hui à 00:00 UTC). Chaque génération crée une nouvelle version."
    )
    public ResponseEntity<NotificationDigest> generate(
            @RequestParam DigestType type,
            @Parameter(description = "Début inclus, ISO-8601")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @Parameter(description = "Fin exclue, ISO-8601")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end,
            @AuthenticationPrincipal String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(digestService.generate(userId, type, start, end));
    }

    @PostMapping("/generate-pending")
    @Operation(summary = "Générer les résumés en retard")
    public ResponseEntity<PendingDigestResult> generatePending(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(digestService.generatePending(userId));
    }
}
