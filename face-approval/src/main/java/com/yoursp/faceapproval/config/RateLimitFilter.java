package com.yoursp.faceapproval.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yoursp.faceapproval.service.storage.ApprovalStore;
import com.yoursp.faceapproval.service.storage.StorageMode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Per-IP sliding window rate limiter using Redis ZADD + ZREMRANGEBYSCORE.
 * <p>
 * Only active on the database backend; with in-memory storage there is no
 * Redis to count in. Redis errors let the request through.
 * </p>
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final ApprovalStore store;
    private final Clock clock;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    public RateLimitFilter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
            ApprovalStore store, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.store = store;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        if (!enabled || store.mode() != StorageMode.DATABASE) {
            chain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        RateLimitConfig config = resolveConfig(path);

        if (config == null) {
            chain.doFilter(request, response);
            return;
        }

        String key = "ratelimit:" + config.endpointKey() + ":" + clientIp(request);

        if (isRateLimited(key, config.maxRequests(), config.windowSeconds())) {
            log.warn("Rate limited: key={}, path={}", key, path);
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(config.windowSeconds()));
            response.setContentType("application/json");
            response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                    "success", false,
                    "error", "RATE_LIMITED",
                    "detail", "Too many requests. Try again later.",
                    "retryAfterSeconds", config.windowSeconds())));
            return;
        }

        chain.doFilter(request, response);
    }

    boolean isRateLimited(String key, int maxRequests, int windowSeconds) {
        try {
            double now = clock.millis();
            double windowStart = now - (windowSeconds * 1000.0);

            redisTemplate.opsForZSet().removeRangeByScore(key, 0, windowStart);

            Long count = redisTemplate.opsForZSet().zCard(key);
            if (count != null && count >= maxRequests) {
                return true;
            }

            redisTemplate.opsForZSet().add(key, String.valueOf(now), now);
            redisTemplate.expire(key, Duration.ofSeconds(windowSeconds + 10L));

            return false;
        } catch (Exception e) {
            log.warn("Rate limit check failed (allowing request): {}", e.getMessage());
            return false;
        }
    }

    private RateLimitConfig resolveConfig(String path) {
        return switch (path) {
            case "/api/capture-face" -> new RateLimitConfig("capture_face", 30, 60);
            case "/api/approve-face" -> new RateLimitConfig("approve_face", 30, 60);
            case "/api/admin/login" -> new RateLimitConfig("admin_login", 10, 60);
            default -> null;
        };
    }

    private String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private record RateLimitConfig(String endpointKey, int maxRequests, int windowSeconds) {
    }
}
