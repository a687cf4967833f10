package fr.tictak.pulse.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Collections;
import java.util.List;

/**
 * Validates access tokens issued by the identity service and extracts the caller identity.
 * The user id comes from the {@code userId} claim, falling back to the subject.
 */
@Component
public class JwtUtils {

    private static final Logger log = LoggerFactory.getLogger(JwtUtils.class);

    public static final String TOKEN_PREFIX = "Bearer ";
    public static final String HEADER_AUTH = "Authorization";

    @Value("${jwt.secret}")
    private String jwtSecret;

    private Key getSigningKey() {
        byte[] keyBytes = jwtSecret.getBytes(StandardCharsets.UTF_8);
        return Keys.hmacShaKeyFor(keyBytes);
    }

    public String extractToken(HttpServletRequest request) {
        return stripBearer(request.getHeader(HEADER_AUTH));
    }

    public static String stripBearer(String header) {
        if (header != null && header.startsWith(TOKEN_PREFIX)) {
            return header.substring(TOKEN_PREFIX.length());
        }
        return null;
    }

    public boolean validateToken(String token) {
        try {
            Claims claims = parse(token);
            if (claims.get("refresh") != null) {
                log.debug("Rejected refresh token used as access token");
                return false;
            }
            return true;
        } catch (ExpiredJwtException e) {
            log.debug("Token expired: {}", e.getMessage());
        } catch (MalformedJwtException e) {
            log.debug("Malformed token: {}", e.getMessage());
        } catch (SignatureException | UnsupportedJwtException | IllegalArgumentException e) {
            log.debug("Invalid token: {}", e.getMessage());
        }
        return false;
    }

    public String getUserIdFromToken(String token) {
        try {
            Claims claims = parse(token);
            String userId = claims.get("userId", String.class);
            if (userId == null || userId.isBlank()) {
                userId = claims.getSubject();
            }
            if (userId == null || userId.isBlank()) {
                throw new JwtException("User id is missing in token");
            }
            return userId;
        } catch (JwtException e) {
            throw new JwtException("Invalid token when extracting userId: " + e.getMessage(), e);
        }
    }

    public List<String> getRolesFromToken(String token) {
        try {
            List<?> roles = parse(token).get("roles", List.class);
            if (roles == null) {
                return Collections.emptyList();
            }
            return roles.stream()
                    .filter(String.class::isInstance)
                    .map(String.class::cast)
                    .toList();
        } catch (JwtException e) {
            throw new JwtException("Invalid token when extracting roles: " + e.getMessage(), e);
        }
    }

    private Claims parse(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSigningKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
