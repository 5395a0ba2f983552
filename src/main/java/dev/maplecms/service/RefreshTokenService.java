package dev.maplecms.service;

import dev.maplecms.entity.RefreshToken;
import dev.maplecms.repository.RefreshTokenRepository;
import dev.maplecms.util.DigestUtils;
import dev.maplecms.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.Base64;

/**
 * Opaque, single-use refresh tokens. Only the SHA-256 digest of a token is stored;
 * the plain value is handed to the client once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefreshTokenService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder BASE64 = Base64.getUrlEncoder().withoutPadding();

    private final RefreshTokenRepository refreshTokenRepository;
    private final IdService idService;

    @Value("${jwt.refresh-expiration:604800000}")
    private long refreshTokenExpirationMs;

    /**
     * Issue a new token for {@code userId}. The returned entity carries the plain token.
     */
    public Mono<RefreshToken> createRefreshToken(Long userId) {
        return Mono.defer(() -> {
            String plainToken = generateToken();
            LocalDateTime now = Timestamps.now();
            RefreshToken refreshToken = RefreshToken.builder()
                    .id(idService.nextId())
                    .userId(userId)
                    .token(DigestUtils.sha256Hex(plainToken))
                    .expiresAt(now.plusNanos(refreshTokenExpirationMs * 1_000_000L))
                    .createdAt(now)
                    .revoked(false)
                    .build();

            return refreshTokenRepository.save(refreshToken)
                    .map(saved -> {
                        saved.setToken(plainToken);
                        return saved;
                    });
        }).doOnSuccess(rt -> log.debug("Refresh token issued for user {}", userId));
    }

    /**
     * Revoke {@code token} and issue its successor. Presenting an already revoked token
     * revokes every token of its user.
     */
    @Transactional
    public Mono<RefreshToken> verifyAndRotate(String token) {
        return refreshTokenRepository.findByToken(DigestUtils.sha256Hex(token))
                .switchIfEmpty(Mono.error(new SecurityException("error.invalid_refresh_token")))
                .flatMap(refreshToken -> {
                    if (refreshToken.isRevoked()) {
                        log.warn("Revoked refresh token presented for user {}, revoking all sessions", refreshToken.getUserId());
                        return refreshTokenRepository.revokeAllByUserId(refreshToken.getUserId())
                                .then(Mono.<RefreshToken>error(new SecurityException("error.invalid_refresh_token")));
                    }
                    if (refreshToken.isExpired()) {
                        return Mono.<RefreshToken>error(new SecurityException("error.refresh_token_expired"));
                    }
                    refreshToken.setRevoked(true);
                    return refreshTokenRepository.save(refreshToken)
                            .then(createRefreshToken(refreshToken.getUserId()));
                });
    }

    /**
     * Revoke {@code token}. Unknown or already revoked tokens are ignored.
     */
    @Transactional
    public Mono<Void> revokeToken(String token) {
        return refreshTokenRepository.findByToken(DigestUtils.sha256Hex(token))
                .filter(refreshToken -> !refreshToken.isRevoked())
                .flatMap(refreshToken -> {
                    refreshToken.setRevoked(true);
                    return refreshTokenRepository.save(refreshToken)
                            .doOnSuccess(saved -> log.info("Refresh token revoked for user {}", saved.getUserId()));
                })
                .then();
    }

    @Scheduled(fixedRateString = "${scheduling.refresh-token-cleanup-ms:3600000}",
            initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void cleanupExpiredTokens() {
        try {
            Long removed = refreshTokenRepository.deleteExpired(Timestamps.now()).block();
            log.info("Expired refresh tokens cleaned up: {}", removed);
        } catch (RuntimeException e) {
            log.error("Failed to clean up expired refresh tokens", e);
        }
    }

    private String generateToken() {
        byte[] randomBytes = new byte[64];
        SECURE_RANDOM.nextBytes(randomBytes);
        return BASE64.encodeToString(randomBytes);
    }
}
