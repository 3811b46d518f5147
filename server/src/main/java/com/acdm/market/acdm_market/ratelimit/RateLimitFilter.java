package com.acdm.market.acdm_market.ratelimit;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import com.acdm.market.acdm_market.controller.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import lombok.extern.slf4j.Slf4j;

/**
 * Enforces the per-client budget. Authenticated requests are keyed by account,
 * anonymous ones by client IP (first X-Forwarded-For hop when present).
 * Runs after JWT authentication so the account is known.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    static final String IDENTIFIER_HEADER = "X-RateLimit-Identifier";

    private final RateLimiter rateLimiter;
    private final List<String> exemptedPaths;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimiter rateLimiter, List<String> exemptedPaths, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.exemptedPaths = exemptedPaths != null ? exemptedPaths : List.of();
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        if (isExempted(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }

        String identifier = identifierOf(request);
        try {
            rateLimiter.acquire(identifier);
        } catch (RateLimitExceededException e) {
            log.warn("Throttled {} on {}", identifier, request.getRequestURI());
            reject(response, e);
            return;
        }

        response.setHeader(IDENTIFIER_HEADER, identifier);
        filterChain.doFilter(request, response);
    }

    private String identifierOf(HttpServletRequest request) {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken)) {
            return "user:" + auth.getName();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private boolean isExempted(String path) {
        return exemptedPaths.stream().anyMatch(path::startsWith);
    }

    private void reject(HttpServletResponse response, RateLimitExceededException e) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(e.getRetryAfterSeconds()));
        response.setHeader(IDENTIFIER_HEADER, e.getIdentifier());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), new ErrorResponse("RateLimitExceeded", e.getMessage()));
        response.getWriter().flush();
    }
}
