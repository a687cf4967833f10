package fr.tictak.pulse.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates REST calls from the bearer access token. The principal is the user id; the token's
 * {@code roles} claim becomes the granted authorities. A missing or rejected token leaves the context
 * empty and the entry point answers 401.
 */
@Slf4j
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtUtils jwtUtils;

    public JwtAuthenticationFilter(JwtUtils jwtUtils) {
        this.jwtUtils = jwtUtils;
    }

    @Override
    protected boolean shouldNotFilter(@NotNull HttpServletRequest request) {
        // CORS preflight carries no token; the STOMP handshake authenticates on CONNECT instead
        return HttpMethod.OPTIONS.matches(request.getMethod())
                || request.getServletPath().startsWith("/ws");
    }

    @Override
    protected void doFilterInternal(@NotNull HttpServletRequest request,
                                    @NotNull HttpServletResponse response,
                                    @NotNull FilterChain chain)
            throws ServletException, IOException {
        String token = jwtUtils.extractToken(request);
        if (token != null) {
            if (jwtUtils.validateToken(token)) {
                SecurityContextHolder.getContext().setAuthentication(authenticate(token));
            } else {
                log.debug("Rejected bearer token on {} {}", request.getMethod(), request.getRequestURI());
            }
        }
        chain.doFilter(request, response);
    }

    private Authentication authenticate(String token) {
        var authorities = jwtUtils.getRolesFromToken(token).stream()
                .map(SimpleGrantedAuthority::new)
                .toList();
        return new UsernamePasswordAuthenticationToken(jwtUtils.getUserIdFromToken(token), null, authorities);
    }
}
