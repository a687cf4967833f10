package fr.tictak.pulse.dto.in;

import fr.tictak.pulse.model.enums.NotificationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * A candidate notification from an event producer. {@code userId} defaults to the caller.
 */
public record DispatchRequest(
        String userId,
        @NotNull(message = "type is required") NotificationType type,
        @NotBlank(message = "title is required") @Size(max = 200, message = "title must not exceed 200 characters") String title,
        @NotBlank(message = "message is required") @Size(max = 4000, message = "message must not exceed 4000 characters") String message,
        Map<String, Object> metadata,
        String sourceId
) {
}
