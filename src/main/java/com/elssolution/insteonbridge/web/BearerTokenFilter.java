package com.elssolution.insteonbridge.web;

import com.elssolution.insteonbridge.config.BridgeSettings;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * When {@code insteon.auth.token} is set, every request except {@code GET /status}
 * must carry it in the Authorization header, with or without the "Bearer " prefix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerTokenFilter extends OncePerRequestFilter {

    private static final String BEARER = "bearer ";

    private final BridgeSettings settings;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String token = settings.getAuthToken();
        if (token == null || token.isEmpty()) return true;
        return "GET".equals(request.getMethod()) && "/status".equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String provided = extractToken(request.getHeader("Authorization"));
        if (provided == null || !matches(provided, settings.getAuthToken())) {
            log.warn("AUTH_FILTER: rejected {} {}", request.getMethod(), request.getRequestURI());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"success\":false,\"error\":\"Invalid or missing bearer token\"}");
            return;
        }
        filterChain.doFilter(request, response);
    }

    static String extractToken(String header) {
        if (header == null || header.isEmpty()) return null;
        if (header.length() >= BEARER.length() && header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return header.substring(BEARER.length());
        }
        return header;
    }

    private static boolean matches(String provided, String expected) {
        return MessageDigest.isEqual(provided.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
    }
}
