package com.phillippitts.geminibridge.config.security;

import com.phillippitts.geminibridge.config.logging.ClientAddress;
import com.phillippitts.geminibridge.config.properties.SecurityProperties;
import com.phillippitts.geminibridge.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires {@code Authorization: Bearer <token>} matching {@code bridge.security.bearer-token}.
 *
 * <p>Tokens are compared in constant time. Health checks and CORS preflight requests are exempt.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class BearerAuthFilter extends OncePerRequestFilter {

    private static final Logger LOG = LogManager.getLogger(BearerAuthFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final byte[] expectedToken;
    private final ErrorResponseWriter errorWriter;

    public BearerAuthFilter(SecurityProperties properties, ErrorResponseWriter errorWriter) {
        this.expectedToken = properties.getBearerToken().getBytes(StandardCharsets.UTF_8);
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PublicPaths.isPublic(request.getRequestURI())
                || HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || header.isBlank()) {
            reject(request, response, "Missing authorization header", "missing_auth_header");
            return;
        }
        if (!header.startsWith(BEARER_PREFIX) || header.length() == BEARER_PREFIX.length()) {
            reject(request, response, "Invalid authorization header format", "invalid_auth_header");
            return;
        }
        byte[] provided = header.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(provided, expectedToken)) {
            reject(request, response, "Invalid bearer token", "invalid_token");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String message, String code)
            throws IOException {
        LOG.warn("{}: client={}, path={}", message,
                LogSanitizer.maskIp(ClientAddress.of(request)), request.getRequestURI());
        errorWriter.write(response, HttpStatus.UNAUTHORIZED.value(), message, "authentication_error", code);
    }
}
