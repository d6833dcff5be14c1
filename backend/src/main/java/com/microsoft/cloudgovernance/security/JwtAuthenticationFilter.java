package com.microsoft.cloudgovernance.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bearer token authentication for the API.
 *
 * TOKEN STRUCTURE:
 * {
 *   "sub": "customer-id",
 *   "org": "organization-id",
 *   "roles": "ROLE_USER,ROLE_ADMIN",
 *   "exp": 1234567890
 * }
 *
 * "tid" is accepted in place of "org" for tokens minted by the portal. A valid
 * token becomes an AuthenticatedContext principal; anything else leaves the
 * request unauthenticated.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String ORGANIZATION_CLAIM = "org";
    static final String TENANT_CLAIM = "tid";
    static final String ROLES_CLAIM = "roles";

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    @Value("${jwt.secret:default-secret-key-for-development-only-32chars}")
    private String jwtSecret;

    @Value("${jwt.issuer:cloud-governance}")
    private String jwtIssuer;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String token = extractToken(request);
        if (token != null) {
            Claims claims = validateToken(token);
            AuthenticatedContext context = claims != null ? toContext(claims) : null;

            if (context != null) {
                List<SimpleGrantedAuthority> authorities = context.roles().stream()
                        .map(SimpleGrantedAuthority::new)
                        .toList();
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(context, null, authorities);
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated customer: {} for organization: {}",
                        context.customerId(), context.organizationId());
            }
        }

        filterChain.doFilter(request, response);
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader(AUTHORIZATION_HEADER);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    private Claims validateToken(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(signingKey())
                    .requireIssuer(jwtIssuer)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

        } catch (ExpiredJwtException e) {
            log.warn("JWT token expired: {}", e.getMessage());
        } catch (JwtException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
        }
        return null;
    }

    private AuthenticatedContext toContext(Claims claims) {
        String organization = claims.get(ORGANIZATION_CLAIM, String.class);
        if (organization == null) {
            organization = claims.get(TENANT_CLAIM, String.class);
        }
        UUID organizationId = parseUuid(organization);
        UUID customerId = parseUuid(claims.getSubject());
        if (organizationId == null || customerId == null) {
            log.warn("JWT token lacks a valid organization or subject claim");
            return null;
        }

        String rolesString = claims.get(ROLES_CLAIM, String.class);
        Set<String> roles = rolesString == null ? Set.of() : Arrays.stream(rolesString.split(","))
                .map(String::trim)
                .filter(r -> !r.isEmpty())
                .collect(Collectors.toSet());
        return new AuthenticatedContext(organizationId, customerId, roles);
    }

    SecretKey signingKey() {
        return Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    private static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") ||
               path.startsWith("/swagger") ||
               path.startsWith("/v3/api-docs") ||
               path.equals("/health");
    }
}
