package fr.tictak.pulse.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of the errors a controller turns into an {@code ErrorResponse}. {@code code} is the stable,
 * machine-readable part of the body; {@code message} is for humans.
 */
@Getter
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
