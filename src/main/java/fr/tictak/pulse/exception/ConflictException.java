package fr.tictak.pulse.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, "ALREADY_EXISTS", message);
    }
}
