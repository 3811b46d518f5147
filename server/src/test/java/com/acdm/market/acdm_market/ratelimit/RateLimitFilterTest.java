package com.acdm.market.acdm_market.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {

    @Mock
    private RateLimiter rateLimiter;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private RateLimitFilter filter() {
        return new RateLimitFilter(rateLimiter, List.of("/auth/"), new ObjectMapper());
    }

    @Test
    void authenticatedRequestsAreKeyedByAccount() throws Exception {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken("alice", null, List.of()));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter().doFilter(new MockHttpServletRequest("POST", "/api/market/sale/buy"), response, chain);

        verify(rateLimiter).acquire("user:alice");
        assertNotNull(chain.getRequest());
        assertEquals("user:alice", response.getHeader(RateLimitFilter.IDENTIFIER_HEADER));
    }

    @Test
    void anonymousRequestsAreKeyedByForwardedAddress() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/market/round");
        request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");

        filter().doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        verify(rateLimiter).acquire("ip:203.0.113.9");
    }

    @Test
    void exhaustedClientsGet429() throws Exception {
        doThrow(new RateLimitExceededException("ip:127.0.0.1", 4)).when(rateLimiter).acquire("ip:127.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter().doFilter(new MockHttpServletRequest("GET", "/api/market/round"), response, chain);

        assertEquals(429, response.getStatus());
        assertEquals("4", response.getHeader("Retry-After"));
        assertTrue(response.getContentAsString().contains("RateLimitExceeded"));
        assertNull(chain.getRequest());
    }

    @Test
    void exemptedPathsSkipTheLimiter() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter().doFilter(new MockHttpServletRequest("POST", "/auth/token"), new MockHttpServletResponse(), chain);

        verifyNoInteractions(rateLimiter);
        assertNotNull(chain.getRequest());
    }
}
