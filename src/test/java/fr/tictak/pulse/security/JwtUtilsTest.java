package fr.tictak.pulse.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtUtils")
class JwtUtilsTest {

    private JwtUtils jwtUtils;

    @BeforeEach
    void setUp() {
        jwtUtils = new JwtUtils();
        ReflectionTestUtils.setField(jwtUtils, "jwtSecret", JwtTestTokens.SECRET);
    }

    @Test
    @DisplayName("Should read the user id and roles of a valid token")
    void shouldReadIdentity() {
        // Given
        String token = JwtTestTokens.token("user-1", Duration.ofMinutes(5), "ROLE_SERVICE");

        // When / Then
        assertThat(jwtUtils.validateToken(token)).isTrue();
        assertThat(jwtUtils.getUserIdFromToken(token)).isEqualTo("user-1");
        assertThat(jwtUtils.getRolesFromToken(token)).containsExactly("ROLE_SERVICE");
    }

    @Test
    @DisplayName("Should reject expired, foreign and refresh tokens")
    void shouldRejectInvalidTokens() {
        // Given
        String expired = JwtTestTokens.token("user-1", Duration.ofMinutes(-5));
        String foreign = Jwts.builder()
                .setSubject("user-1")
                .signWith(Keys.hmacShaKeyFor("another-secret-another-secret-another-secret-99".getBytes(StandardCharsets.UTF_8)),
                        SignatureAlgorithm.HS256)
                .compact();
        String refresh = Jwts.builder()
                .setSubject("user-1")
                .claim("refresh", true)
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(JwtTestTokens.SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        // When / Then
        assertThat(jwtUtils.validateToken(expired)).isFalse();
        assertThat(jwtUtils.validateToken(foreign)).isFalse();
        assertThat(jwtUtils.validateToken(refresh)).isFalse();
        assertThat(jwtUtils.validateToken("not-a-token")).isFalse();
    }

    @Test
    @DisplayName("Should keep only string roles and default to none")
    void shouldReadRolesDefensively() {
        // Given
        String mixed = Jwts.builder()
                .setSubject("user-1")
                .claim("roles", List.of("ROLE_ADMIN", 42, Map.of("name", "ROLE_SERVICE")))
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(JwtTestTokens.SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
        String none = Jwts.builder()
                .setSubject("user-1")
                .setExpiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(JwtTestTokens.SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();

        // When / Then
        assertThat(jwtUtils.getRolesFromToken(mixed)).containsExactly("ROLE_ADMIN");
        assertThat(jwtUtils.getRolesFromToken(none)).isEmpty();
    }

    @Test
    @DisplayName("Should strip the bearer prefix only when present")
    void shouldStripBearer() {
        assertThat(JwtUtils.stripBearer("Bearer abc")).isEqualTo("abc");
        assertThat(JwtUtils.stripBearer("Basic abc")).isNull();
        assertThat(JwtUtils.stripBearer(null)).isNull();
    }
}
