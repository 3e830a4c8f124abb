package com.example.cortex.config;

import com.example.cortex.domain.OperationClass;
import com.example.cortex.domain.RateLimitStatus;
import com.example.cortex.service.ratelimit.RateLimitIdentityResolver;
import com.example.cortex.service.ratelimit.RateLimiterService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the recall ceiling to read requests against the memory API. Reads are counted in the
 * same shared bucket store as writes, so every instance enforces one ceiling per caller.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String SESSION_TOKEN_HEADER = "X-Session-Token";

    private final CortexSecurityProperties securityProperties;
    private final RateLimiterService rateLimiter;
    private final RateLimitIdentityResolver identityResolver;
    private final Clock clock;

    public RateLimitingFilter(
            CortexSecurityProperties securityProperties,
            RateLimiterService rateLimiter,
            RateLimitIdentityResolver identityResolver,
            Clock clock) {
        this.securityProperties = securityProperties;
        this.rateLimiter = rateLimiter;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !securityProperties.isRateLimitingEnabled()
                || !HttpMethod.GET.matches(request.getMethod())
                || !request.getRequestURI().startsWith(securityProperties.getGuardedPath());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String identity = resolveKey(request);
        RateLimitStatus status = rateLimiter.admit(identity, OperationClass.RECALL);
        writeRateLimitHeaders(response, status);
        if (status.allowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Read throttle rejected {} {} for {}", request.getMethod(), request.getRequestURI(), identity);
        writeRateLimitResponse(response, status);
    }

    private void writeRateLimitHeaders(HttpServletResponse response, RateLimitStatus status) {
        response.setHeader("X-RateLimit-Limit", String.valueOf(status.limit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(status.remaining()));
        response.setHeader("X-RateLimit-Reset", String.valueOf(status.resetTime().getEpochSecond()));
    }

    private void writeRateLimitResponse(HttpServletResponse response, RateLimitStatus status) throws IOException {
        long retryAfterSeconds = Math.max(status.retryAfterSeconds(), 1);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        response.getWriter().write(("{\"timestamp\":\"%s\",\"error\":\"Rate limit exceeded. Retry after %d seconds.\","
                + "\"code\":\"rate_limit_exceeded\"}").formatted(Instant.now(clock), retryAfterSeconds));
    }

    String resolveKey(HttpServletRequest request) {
        String userId = request.getParameter("userId");
        if (!StringUtils.hasText(userId)) {
            userId = request.getHeader(USER_ID_HEADER);
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String clientAddress = StringUtils.hasText(forwardedFor)
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        return identityResolver.resolve(userId, request.getHeader(SESSION_TOKEN_HEADER), clientAddress);
    }
}
