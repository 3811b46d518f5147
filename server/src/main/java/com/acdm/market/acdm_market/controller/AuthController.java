package com.acdm.market.acdm_market.controller;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.acdm.market.acdm_market.controller.dto.TokenRequest;
import com.acdm.market.acdm_market.controller.dto.TokenResponse;
import com.acdm.market.acdm_market.security.JwtUtil;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues tokens for any account without proof of ownership. Local development only;
 * deployments get tokens from the external identity provider sharing the signing secret.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@ConditionalOnProperty(name = "security.jwt.dev-issuer", havingValue = "true")
public class AuthController {

    private final JwtUtil jwtUtil;

    @PostMapping("/token")
    public TokenResponse token(@Valid @RequestBody TokenRequest request) {
        log.info("Issued development token for {}", request.getAccount());
        return new TokenResponse(request.getAccount(), jwtUtil.generateToken(request.getAccount()));
    }
}
