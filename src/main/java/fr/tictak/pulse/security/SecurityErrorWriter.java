package fr.tictak.pulse.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.tictak.pulse.exception.GlobalExceptionHandler.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * Writes security failures with the same body shape the controllers use.
 */
@Component
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    public SecurityErrorWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response,
                      HttpStatus status, String message, String code) throws IOException {
        response.setStatus(status.value());
        response.setContentType("application/json; charset=UTF-8");
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                message, request.getRequestURI(), code);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
