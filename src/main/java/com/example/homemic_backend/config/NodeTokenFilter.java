package com.example.homemic_backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Shared-secret check for the routes capture nodes call. Does nothing when no token is configured.
 */
public class NodeTokenFilter extends OncePerRequestFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeTokenFilter.class);
    public static final String HEADER = "X-Node-Token";

    private static final List<String> NODE_ROUTES = List.of(
            "/api/batch/upload",
            "/api/nodes/*/heartbeat",
            "/api/nodes/*/audio-level"
    );

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final byte[] expected;

    public NodeTokenFilter(String token) {
        this.expected = token == null || token.isBlank() ? null : token.trim().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (expected == null) {
            return true;
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return NODE_ROUTES.stream().noneMatch(p -> matcher.match(p, path));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String presented = request.getHeader(HEADER);
        if (presented == null || !MessageDigest.isEqual(expected, presented.trim().getBytes(StandardCharsets.UTF_8))) {
            LOGGER.warn("Rejected node request path={} remote={}", request.getRequestURI(), request.getRemoteAddr());
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"error_code\":\"NODE_TOKEN_INVALID\",\"message\":\"Missing or invalid " + HEADER + "\"}");
            return;
        }
        chain.doFilter(request, response);
    }
}
