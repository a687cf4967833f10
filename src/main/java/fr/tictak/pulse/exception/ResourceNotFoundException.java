package fr.tictak.pulse.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing document, or one owned by another user: the two are reported the same way.
 */
public class ResourceNotFoundException extends ApiException {

    public ResourceNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message);
    }

    public static ResourceNotFoundException of(String kind, String id) {
        return new ResourceNotFoundException(kind + " not found: " + id);
    }
}
