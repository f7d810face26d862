package com.example.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitingFilterTest {

    private BridgeSecurityProperties properties;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new BridgeSecurityProperties();
        properties.getRateLimit().setCapacity(2);
        properties.getRateLimit().setRefillTokens(2);
        filter = new RateLimitingFilter(properties);
    }

    private MockHttpServletResponse call(String client, String path) throws Exception {
        return call("POST", client, path);
    }

    private MockHttpServletResponse call(String method, String client, String path) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.addHeader(RateLimitingFilter.CLIENT_HEADER, client);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, response, chain);
        if (response.getStatus() == 200) {
            assertNotNull(chain.getRequest());
        }
        return response;
    }

    @Test
    void rejectsRequestsBeyondBurst() throws Exception {
        assertEquals(200, call("adapter-1", "/api/thread-mappings/resolve").getStatus());
        assertEquals(200, call("adapter-1", "/api/thread-mappings/resolve").getStatus());

        MockHttpServletResponse limited = call("adapter-1", "/api/thread-mappings/resolve");

        assertEquals(429, limited.getStatus());
        assertEquals("60", limited.getHeader("Retry-After"));
        assertTrue(limited.getContentAsString().contains("too_many_requests"));
    }

    @Test
    void bucketsArePerClientAndPath() throws Exception {
        call("adapter-1", "/api/thread-mappings/resolve");
        call("adapter-1", "/api/thread-mappings/resolve");

        assertEquals(200, call("adapter-2", "/api/thread-mappings/resolve").getStatus());
        assertEquals(200, call("adapter-1", "/api/thread-mappings/sweep").getStatus());
    }

    @Test
    void threadIdsInThePathShareOneEndpointBucket() throws Exception {
        int allowed = 0;
        for (int i = 0; i < 1000; i++) {
            if (call("GET", "adapter-1", "/api/thread-mappings/thread-" + i + "/context").getStatus() == 200) {
                allowed++;
            }
        }

        assertEquals(2, allowed);
        assertEquals(1, filter.trackedKeys());
    }

    @Test
    void mapsRequestPathsToEndpointPatterns() {
        assertEquals("/api/thread-mappings/resolve", filter.route("/api/thread-mappings/resolve"));
        assertEquals("/api/thread-mappings/{threadId}", filter.route("/api/thread-mappings/thread-9"));
        assertEquals("/api/thread-mappings/{threadId}/deactivate",
                filter.route("/api/thread-mappings/thread-9/deactivate"));
        assertEquals(RateLimitingFilter.FALLBACK_ROUTE, filter.route("/api/unknown/a/b"));
    }

    @Test
    void mintedClientIdsCannotGrowBucketsPastTheBound() throws Exception {
        properties.getRateLimit().setMaxTrackedKeys(50);
        filter = new RateLimitingFilter(properties);

        for (int i = 0; i < 500; i++) {
            call("minted-" + i, "/api/thread-mappings/resolve");
        }

        assertEquals(50, filter.trackedKeys());
    }

    @Test
    void leavesNonApiPathsAlone() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertEquals(200, call("adapter-1", "/actuator/health").getStatus());
        }
    }

    @Test
    void passesEverythingWhenDisabled() throws Exception {
        properties.setRateLimitingEnabled(false);

        for (int i = 0; i < 5; i++) {
            MockHttpServletResponse response = call("adapter-1", "/api/thread-mappings/resolve");
            assertEquals(200, response.getStatus());
            assertNull(response.getHeader("Retry-After"));
        }
    }
}
