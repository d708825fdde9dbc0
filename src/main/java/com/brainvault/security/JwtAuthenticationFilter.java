package com.brainvault.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Turns a valid bearer token into the request's Authentication.
 *
 * The principal is the token subject, which every owner-scoped query uses as its owner key.
 * While the request runs, the owner is also exposed to log lines through the {@code owner}
 * MDC key.
 *
 * A missing or unusable token leaves the context empty. Access rules in SecurityConfig then
 * decide, and RestAuthenticationEntryPoint writes the 401.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String MDC_OWNER = "owner";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        Authentication authentication = authenticate(request);
        if (authentication == null) {
            filterChain.doFilter(request, response);
            return;
        }

        SecurityContextHolder.getContext().setAuthentication(authentication);
        MDC.put(MDC_OWNER, authentication.getName());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_OWNER);
        }
    }

    private Authentication authenticate(HttpServletRequest request) {
        String token = jwtTokenProvider.extractTokenFromHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            return null;
        }
        if (!jwtTokenProvider.validateToken(token)) {
            log.warn("Rejected bearer token: {} {}", request.getMethod(), request.getRequestURI());
            return null;
        }

        try {
            Authentication authentication = jwtTokenProvider.getAuthentication(token);
            log.debug("Authenticated owner {} for {}", authentication.getName(), request.getRequestURI());
            return authentication;
        } catch (RuntimeException ex) {
            log.error("Could not build authentication from token: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return request.getRequestURI().startsWith("/error");
    }
}
