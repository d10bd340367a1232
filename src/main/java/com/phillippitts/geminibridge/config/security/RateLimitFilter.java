package com.phillippitts.geminibridge.config.security;

import com.phillippitts.geminibridge.config.logging.ClientAddress;
import com.phillippitts.geminibridge.util.LogSanitizer;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Rejects clients that exceed the sliding window request budget with HTTP 429.
 *
 * <p>Allowed responses carry {@code X-RateLimit-Remaining}. Health checks are exempt.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger LOG = LogManager.getLogger(RateLimitFilter.class);

    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final SlidingWindowRateLimiter limiter;
    private final ErrorResponseWriter errorWriter;

    public RateLimitFilter(SlidingWindowRateLimiter limiter, ErrorResponseWriter errorWriter) {
        this.limiter = limiter;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PublicPaths.isPublic(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String client = ClientAddress.of(request);
        SlidingWindowRateLimiter.Decision decision = limiter.tryAcquire(client);
        if (!decision.allowed()) {
            LOG.warn("Rate limit exceeded: client={}, path={}", LogSanitizer.maskIp(client), request.getRequestURI());
            errorWriter.write(response, HttpStatus.TOO_MANY_REQUESTS.value(),
                    "Rate limit exceeded. Please try again later.",
                    "rate_limit_exceeded", "rate_limit_exceeded");
            return;
        }
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        filterChain.doFilter(request, response);
    }
}
