package fr.tictak.pulse.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Rejected write of a rule, condition or preference. Carries every violation found, not only the first one.
 */
@Getter
public class ValidationException extends ApiException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String violation) {
        this(List.of(violation));
    }
}
