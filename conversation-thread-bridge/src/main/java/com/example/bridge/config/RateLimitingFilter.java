package com.example.bridge.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token bucket per client and endpoint in front of {@code /api/**}. Clients identify themselves with
 * {@code X-Client-Id}; the remote address is used otherwise. Path variables are folded into the
 * endpoint pattern, and the least recently used buckets are dropped once
 * {@code bridge.security.rate-limit.max-tracked-keys} is reached.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String CLIENT_HEADER = "X-Client-Id";
    static final String FALLBACK_ROUTE = "/api/**";

    // Literal routes come before the ones that capture a thread id.
    private static final List<String> ROUTES = List.of(
            "/api/thread-mappings",
            "/api/thread-mappings/resolve",
            "/api/thread-mappings/sweep",
            "/api/thread-mappings/{threadId}/context",
            "/api/thread-mappings/{threadId}/deactivate",
            "/api/thread-mappings/{threadId}");

    private final BridgeSecurityProperties securityProperties;
    private final PathMatcher pathMatcher = new AntPathMatcher();
    private final Map<String, Bucket> buckets;

    public RateLimitingFilter(BridgeSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
        int maxTrackedKeys = Math.max(securityProperties.getRateLimit().getMaxTrackedKeys(), 1);
        this.buckets = Collections.synchronizedMap(new LinkedHashMap<String, Bucket>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Bucket> eldest) {
                return size() > maxTrackedKeys;
            }
        });
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (!securityProperties.isRateLimitingEnabled() || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        Bucket bucket = buckets.computeIfAbsent(resolveKey(request), key -> newBucket());
        if (bucket.tryConsume(1)) {
            filterChain.doFilter(request, response);
            return;
        }

        writeRateLimitResponse(response);
    }

    private Bucket newBucket() {
        BridgeSecurityProperties.RateLimit limitConfig = securityProperties.getRateLimit();
        Duration refillPeriod = refillPeriod();
        long capacity = Math.max(limitConfig.getCapacity(), 1);
        long refillTokens = Math.max(limitConfig.getRefillTokens(), 1);

        Bandwidth limit = Bandwidth.classic(capacity, Refill.greedy(refillTokens, refillPeriod));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    private Duration refillPeriod() {
        Duration refillPeriod = securityProperties.getRateLimit().getRefillPeriod();
        if (refillPeriod == null || refillPeriod.isZero() || refillPeriod.isNegative()) {
            return Duration.ofSeconds(60);
        }
        return refillPeriod;
    }

    private void writeRateLimitResponse(HttpServletResponse response) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(Math.max(refillPeriod().toSeconds(), 1)));
        response.getWriter()
                .write("{\"error\":\"too_many_requests\",\"message\":\"Request rate exceeded. Please retry later.\"}");
    }

    private String resolveKey(HttpServletRequest request) {
        String clientId = request.getHeader(CLIENT_HEADER);
        if (!StringUtils.hasText(clientId)) {
            String forwardedFor = request.getHeader("X-Forwarded-For");
            clientId = StringUtils.hasText(forwardedFor)
                    ? forwardedFor.split(",")[0].trim()
                    : request.getRemoteAddr();
        }
        return clientId + ":" + request.getMethod() + " " + route(request.getRequestURI());
    }

    String route(String requestUri) {
        for (String route : ROUTES) {
            if (pathMatcher.match(route, requestUri)) {
                return route;
            }
        }
        return FALLBACK_ROUTE;
    }

    int trackedKeys() {
        return buckets.size();
    }
}
