package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.out.PatternInsights;
import fr.tictak.pulse.model.NotificationPattern;
import fr.tictak.pulse.service.PatternService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequestMapping("/api/notification-patterns")
@Tag(name = "Tendances", description = "Motifs récurrents détectés dans les notifications.")
public class PatternController {

    private final PatternService patternService;

    public PatternController(PatternService patternService) {
        this.patternService = patternService;
    }

    @GetMapping
    public ResponseEntity<List<NotificationPattern>> list(@RequestParam(required = false) String patternKey,
                                                          @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(patternService.list(userId, patternKey));
    }

    @GetMapping("/{patternId}")
    public ResponseEntity<NotificationPattern> get(@PathVariable String patternId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(patternService.get(userId, patternId));
    }

    @GetMapping("/insights/summary")
    @Operation(summary = "Synthèse des tendances", description = "Confiance moyenne et classements par confiance et par fréquence.")
    public ResponseEntity<PatternInsights> insights(@RequestParam(defaultValue = "5") @Min(1) @Max(50) int limit,
                                                    @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(patternService.insights(userId, limit));
    }

    @DeleteMapping("/{patternId}")
    @Operation(summary = "Supprimer une tendance")
    public ResponseEntity<Void> delete(@PathVariable String patternId, @AuthenticationPrincipal String userId) {
        patternService.delete(userId, patternId);
        return ResponseEntity.noContent().build();
    }
}
