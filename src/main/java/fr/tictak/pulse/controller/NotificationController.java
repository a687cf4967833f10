package fr.tictak.pulse.controller;

import fr.tictak.pulse.dto.in.DispatchRequest;
import fr.tictak.pulse.dto.out.DispatchResult;
import fr.tictak.pulse.dto.out.MarkAllReadResponse;
import fr.tictak.pulse.dto.out.NotificationListResponse;
import fr.tictak.pulse.exception.BadRequestException;
import fr.tictak.pulse.exception.ForbiddenException;
import fr.tictak.pulse.model.Notification;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.service.dispatch.DeliveryDispatcher;
import fr.tictak.pulse.service.implementation.NotificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/notifications")
@Tag(name = "Notifications", description = "Consultation, lecture et suppression des notifications de l'utilisateur connecté, et envoi de notifications par les producteurs d'événements.")
public class NotificationController {

    private static final Logger logger = LoggerFactory.getLogger(NotificationController.class);
    private static final Set<String> DISPATCH_ON_BEHALF_ROLES = Set.of("ROLE_SERVICE", "ROLE_ADMIN");

    private final NotificationService notificationService;
    private final DeliveryDispatcher dispatcher;

    public NotificationController(NotificationService notificationService, DeliveryDispatcher dispatcher) {
        this.notificationService = notificationService;
        this.dispatcher = dispatcher;
    }

    @GetMapping
    @Operation(
            summary = "Lister les notifications",
            description = "Retourne les notifications de l'utilisateur, les plus récentes en premier, avec le nombre total de non lues."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Liste retournée avec succès",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = NotificationListResponse.class),
                            examples = @ExampleObject(value = """
                                    {
                                        "notifications": [
                                            {
                                                "id": "6651f0c2a1b2c3d4e5f60718",
                                                "userId": "42",
                                                "type": "task_due_soon",
                                                "title": "Tâche à rendre",
                                                "message": "Le rapport est à rendre demain",
                                                "read": false,
                                                "metadata": {"priority": "high"}
                                            }
                                        ],
                                        "total": 1,
                                        "unreadCount": 1
                                    }
                                    """))),
            @ApiResponse(responseCode = "401", description = "Jeton absent ou invalide")
    })
    public ResponseEntity<NotificationListResponse> list(
            @Parameter(description = "Ne retourner que les notifications non lues")
            @RequestParam(defaultValue = "false") boolean unreadOnly,
            @Parameter(description = "Filtrer par type (ex. 'task_due_soon')")
            @RequestParam(required = false) NotificationType type,
            @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(notificationService.list(userId, unreadOnly, type));
    }

    @GetMapping("/unread-count")
    @Operation(summary = "Nombre de notifications non lues")
    public ResponseEntity<Map<String, Long>> unreadCount(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(Map.of("count", notificationService.unreadCount(userId)));
    }

    @GetMapping("/{notificationId}")
    @Operation(summary = "Récupérer une notification")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Notification trouvée"),
            @ApiResponse(responseCode = "403", description = "La notification appartient à un autre utilisateur"),
            @ApiResponse(responseCode = "404", description = "Notification introuvable")
    })
    public ResponseEntity<Notification> get(@PathVariable String notificationId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(notificationService.get(userId, notificationId));
    }

    @PatchMapping("/{notificationId}/read")
    @Operation(
            summary = "Marquer une notification comme lue",
            description = "Opération idempotente. Le nouveau compteur de non lues est poussé aux sessions temps réel de l'utilisateur."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Notification marquée comme lue"),
            @ApiResponse(responseCode = "403", description = "La notification appartient à un autre utilisateur"),
            @ApiResponse(responseCode = "404", description = "Notification introuvable")
    })
    public ResponseEntity<Notification> markAsRead(@PathVariable String notificationId, @AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(notificationService.markAsRead(userId, notificationId));
    }

    @PostMapping("/read-all")
    @Operation(summary = "Marquer toutes les notifications comme lues", description = "Opération idempotente.")
    public ResponseEntity<MarkAllReadResponse> markAllAsRead(@AuthenticationPrincipal String userId) {
        return ResponseEntity.ok(notificationService.markAllAsRead(userId));
    }

    @DeleteMapping("/{notificationId}")
    @Operation(summary = "Supprimer une notification")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Notification supprimée"),
            @ApiResponse(responseCode = "403", description = "La notification appartient à un autre utilisateur"),
            @ApiResponse(responseCode = "404", description = "Notification introuvable")
    })
    public ResponseEntity<Void> delete(@PathVariable String notificationId, @AuthenticationPrincipal String userId) {
        notificationService.delete(userId, notificationId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping
    @Operation(
            summary = "Envoyer une notification",
            description = "Point d'entrée des producteurs d'événements. La notification est enregistrée puis acheminée selon les préférences et règles du destinataire. "
                    + "Seuls les rôles SERVICE et ADMIN peuvent cibler un autre utilisateur."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Notification enregistrée, livrée ou supprimée selon les règles",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = DispatchResult.class))),
            @ApiResponse(responseCode = "400", description = "Requête invalide"),
            @ApiResponse(responseCode = "403", description = "Envoi pour le compte d'un autre utilisateur non autorisé")
    })
    public ResponseEntity<DispatchResult> dispatch(@Valid @RequestBody DispatchRequest request, Authentication authentication) {
        String caller = authentication.getName();
        String target = request.userId() == null || request.userId().isBlank() ? caller : request.userId();
        if (!target.equals(caller) && !canDispatchOnBehalf(authentication)) {
            logger.warn("User {} tried to dispatch a notification to user {}", caller, target);
            throw new ForbiddenException("You are not allowed to notify another user");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(dispatcher.dispatch(target, request));
    }

    @PatchMapping("/fcm-token")
    @Operation(summary = "Enregistrer le jeton FCM de l'appareil", description = "Utilisé pour les notifications push mobiles.")
    public ResponseEntity<String> updateFcmToken(@RequestParam String fcmToken, @AuthenticationPrincipal String userId) {
        if (fcmToken == null || fcmToken.trim().isEmpty()) {
            throw new BadRequestException("FCM token cannot be null or empty");
        }
        notificationService.updateFcmToken(userId, fcmToken.trim());
        return ResponseEntity.ok("FCM token updated successfully");
    }

    @PatchMapping("/email")
    @Operation(summary = "Enregistrer l'adresse e-mail de livraison")
    public ResponseEntity<String> updateEmail(@RequestParam String email, @AuthenticationPrincipal String userId) {
        if (email == null || !email.contains("@")) {
            throw new BadRequestException("A valid e-mail address is required");
        }
        notificationService.updateEmail(userId, email.trim());
        return ResponseEntity.ok("E-mail updated successfully");
    }

    private static boolean canDispatchOnBehalf(Authentication authentication) {
        for (GrantedAuthority authority : authentication.getAuthorities()) {
            if (DISPATCH_ON_BEHALF_ROLES.contains(authority.getAuthority())) {
                return true;
            }
        }
        return false;
    }
}
