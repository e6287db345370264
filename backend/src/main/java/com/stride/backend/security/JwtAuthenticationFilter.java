package com.stride.backend.security;

import com.stride.backend.audit.AuthAuditor;
import com.stride.backend.config.SecurityProperties;
import com.stride.backend.exception.TokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Validates bearer access tokens and installs the caller as principal.
 * A rejected token leaves the request unauthenticated; the entry point answers it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final TokenService tokenService;
    private final AuthAuditor authAuditor;
    private final SecurityProperties securityProperties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> publicPaths = List.of(
            "/actuator/health",
            "/actuator/health/**",
            "/v3/api-docs",
            "/v3/api-docs/**",
            "/swagger-ui.html",
            "/swagger-ui/**",
            "/api/auth/register",
            "/api/auth/login",
            "/api/auth/refresh"
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<String> jwt = tokenService.extractBearerToken(request.getHeader("Authorization"));
        if (jwt.isPresent()) {
            try {
                TokenClaims claims = tokenService.validate(jwt.get(), TokenType.ACCESS);
                UserPrincipal principal = UserPrincipal.builder()
                        .userId(claims.subject())
                        .email(claims.email())
                        .tokenId(claims.jti())
                        .tokenExpiresAt(claims.expiresAt())
                        .build();
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        authoritiesFor(claims)
                );
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);

                log.debug("Authenticated user: {}", claims.subject());
            } catch (TokenException ex) {
                logRejection(request, ex);
                authAuditor.tokenRejected(request, ex.reasonCode());
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return publicPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    private List<SimpleGrantedAuthority> authoritiesFor(TokenClaims claims) {
        boolean admin = claims.email() != null && securityProperties.getAdminEmails().stream()
                .anyMatch(claims.email()::equalsIgnoreCase);
        return admin
                ? List.of(new SimpleGrantedAuthority("ROLE_USER"), new SimpleGrantedAuthority("ROLE_ADMIN"))
                : List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }

    private void logRejection(HttpServletRequest request, TokenException ex) {
        String path = request.getRequestURI();
        switch (ex.getReason()) {
            case EXPIRED -> log.debug("Expired access token on {}", path);
            case MALFORMED -> log.info("Malformed bearer token on {}: {}", path, ex.getMessage());
            case WRONG_TYPE -> log.warn("Non-access token presented as bearer on {}", path);
            case INVALID_SIGNATURE -> log.warn("Bearer token with invalid signature on {}", path);
            case REVOKED -> log.warn("Revoked access token presented on {}", path);
        }
    }
}
