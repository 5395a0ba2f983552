package dev.maplecms.controller;

import dev.maplecms.dto.LoginRequest;
import dev.maplecms.dto.MessageResponse;
import dev.maplecms.dto.RefreshRequest;
import dev.maplecms.dto.RegisterRequest;
import dev.maplecms.dto.TokenResponse;
import dev.maplecms.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Registration, login and token refresh")
@Slf4j
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates an AUTHOR account and signs it in")
    public Mono<ResponseEntity<TokenResponse>> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration attempt for username='{}'", request.username());
        return authService.register(request)
                .map(tokens -> ResponseEntity.status(HttpStatus.CREATED).body(tokens));
    }

    @PostMapping("/login")
    @Operation(summary = "Login")
    public Mono<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for user='{}'", request.getEmail());
        return authService.login(request);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh tokens", description = "The presented refresh token is revoked")
    public Mono<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return authService.refresh(request.refreshToken());
    }

    @PostMapping("/logout")
    @Operation(summary = "Logout", description = "Revokes the refresh token")
    public Mono<MessageResponse> logout(@Valid @RequestBody RefreshRequest request) {
        return authService.logout(request.refreshToken())
                .then(Mono.fromSupplier(() -> MessageResponse.of("Logged out")));
    }
}
