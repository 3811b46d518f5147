package com.acdm.market.acdm_market.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.util.Date;

/**
 * Issues and verifies HS256 bearer tokens whose subject is the market account.
 */
@Slf4j
public class JwtUtil {

    private final Key key;
    private final long expireSeconds;
    private final Clock clock;

    public JwtUtil(String secret, long expireSeconds, Clock clock) {
        // HS256 needs at least 32 bytes of key material
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expireSeconds = expireSeconds;
        this.clock = clock;
    }

    public String generateToken(String account) {
        Date now = Date.from(clock.instant());
        Date exp = new Date(now.getTime() + expireSeconds * 1000);
        return Jwts.builder()
                .setSubject(account)
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the account the token was issued to, or null when the token is
     *         malformed, badly signed or expired
     */
    public String validateToken(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return claims.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return null;
        }
    }
}
