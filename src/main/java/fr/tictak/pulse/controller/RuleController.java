package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.in.ApplyRulesRequest;
import fr.tictak.pulse.dto.in.RuleRequest;
import fr.tictak.pulse.dto.out.RuleBatchResult;
import fr.tictak.pulse.dto.out.RuleTestResult;
import fr.tictak.pulse.model.NotificationRule;
import fr.tictak.pulse.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/notification-rules")
@Tag(name = "Règles de notification", description = "Règles conditionnelles évaluées par ordre de priorité sur chaque notification.")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping
    @Operation(summary = "Lister les règles", description = "Triées par priorité décroissante.")
    public ResponseEntity<List<NotificationRule>> list(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(ruleService.list(userId));
    }

    @GetMapping("/{ruleId}")
    @Operation(summary = "Récupérer une règle")
    public ResponseEntity<NotificationRule> get(@PathVariable String ruleId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(ruleService.get(userId, ruleId));
    }

    @PostMapping
    @Operation(
            summary = "Créer une règle",
            description = "La condition est un arbre de nœuds 'all', 'any', 'not' et 'field'. Une règle invalide est rejetée sans rien enregistrer."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Règle créée"),
            @ApiResponse(responseCode = "400", description = "Règle invalide",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                        "status": 400,
                                        "error": "Bad Request",
                                        "message": "Invalid rule: condition.operator 'between' is not supported",
                                        "path": "/api/notification-rules",
                                        "code": "VALIDATION_FAILED"
                                    }
                                    """)))
    })
    public ResponseEntity<NotificationRule> create(@Valid @RequestBody RuleRequest request,
                                                   @AuthenticationPrincipal String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleService.create(userId, request));
    }

    @PutMapping("/{ruleId}")
    @Operation(summary = "Modifier une règle", description = "Les champs absents sont conservés. La règle résultante est revalidée.")
    public ResponseEntity<NotificationRule> update(@PathVariable String ruleId, @Valid @RequestBody RuleRequest request,
                                                   @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(ruleService.update(userId, ruleId, request));
    }

    @DeleteMapping("/{ruleId}")
    @Operation(summary = "Supprimer une règle")
    public ResponseEntity<Void> delete(@PathVariable String ruleId, @AuthenticationPrincipal String userId) {
        ruleService.delete(userId, ruleId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{ruleId}/test")
    @Operation(summary = "Tester une règle", description = "Évalue la règle sur une notification existante sans effet de bord.")
    public ResponseEntity<RuleTestResult> test(@PathVariable String ruleId,
                                               @Parameter(description = "Identifiant de la notification de test")
                                               @RequestParam String notificationId,
                                               @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(ruleService.test(userId, ruleId, notificationId));
    }

    @PostMapping("/apply-to-existing")
    @Operation(summary = "Appliquer les règles aux notifications existantes",
            description = "Sans identifiants, s'applique à toutes les notifications non lues.")
    public ResponseEntity<RuleBatchResult> applyToExisting(@RequestBody(required = false) ApplyRulesRequest request,
                                                           @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(ruleService.applyToExisting(userId, request));
    }
}
