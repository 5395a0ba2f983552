package dev.maplecms.service;

import dev.maplecms.dto.LoginRequest;
import dev.maplecms.dto.RegisterRequest;
import dev.maplecms.dto.TokenResponse;
import dev.maplecms.entity.User;
import dev.maplecms.entity.UserRole;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.UserRepository;
import dev.maplecms.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final UserService userService;
    private final RefreshTokenService refreshTokenService;
    private final JwtTokenProvider tokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final ContentMetrics metrics;

    /**
     * Self-registration. New accounts start as AUTHOR.
     */
    public Mono<TokenResponse> register(RegisterRequest request) {
        return userService.insertUser(request.username(), request.email(), request.password(), UserRole.AUTHOR, true)
                .doOnSuccess(user -> log.info("User registered: {}", user.getUsername()))
                .flatMap(this::issueTokens);
    }

    public Mono<TokenResponse> login(LoginRequest request) {
        String email = request.getEmail().trim().toLowerCase(Locale.ROOT);
        return userRepository.findByEmail(email)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Login failed: unknown email");
                    metrics.login(false);
                    return Mono.error(new BadCredentialsException("error.invalid_credentials"));
                }))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.matches(request.getPassword(), user.getPasswordHash()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(matches -> {
                            if (!matches) {
                                log.warn("Login failed for user {}: bad password", user.getId());
                                metrics.login(false);
                                return Mono.<User>error(new BadCredentialsException("error.invalid_credentials"));
                            }
                            if (!Boolean.TRUE.equals(user.getActive())) {
                                log.warn("Login refused for disabled user {}", user.getId());
                                metrics.login(false);
                                return Mono.<User>error(new BadCredentialsException("error.account_disabled"));
                            }
                            return Mono.just(user);
                        }))
                .doOnSuccess(user -> {
                    metrics.login(true);
                    log.info("User logged in: {}", user.getUsername());
                })
                .flatMap(this::issueTokens);
    }

    /**
     * Exchange a refresh token for a new access token and a rotated refresh token.
     */
    public Mono<TokenResponse> refresh(String refreshToken) {
        return refreshTokenService.verifyAndRotate(refreshToken)
                .flatMap(rotated -> userRepository.findById(rotated.getUserId())
                        .filter(user -> Boolean.TRUE.equals(user.getActive()))
                        .switchIfEmpty(Mono.error(new SecurityException("error.invalid_refresh_token")))
                        .map(user -> buildResponse(user, rotated.getToken())));
    }

    public Mono<Void> logout(String refreshToken) {
        return refreshTokenService.revokeToken(refreshToken);
    }

    private Mono<TokenResponse> issueTokens(User user) {
        return refreshTokenService.createRefreshToken(user.getId())
                .map(refreshToken -> buildResponse(user, refreshToken.getToken()));
    }

    private TokenResponse buildResponse(User user, String refreshToken) {
        return TokenResponse.builder()
                .accessToken(tokenProvider.generateToken(user.getEmail(), user.getRole()))
                .refreshToken(refreshToken)
                .expiresIn(tokenProvider.getExpirationSeconds())
                .email(user.getEmail())
                .username(user.getUsername())
                .role(user.getRole())
                .build();
    }
}
