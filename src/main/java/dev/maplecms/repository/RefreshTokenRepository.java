package dev.maplecms.repository;

import dev.maplecms.entity.RefreshToken;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RefreshTokenRepository extends ReactiveCrudRepository<RefreshToken, Long> {

    Mono<RefreshToken> findByToken(String token);

    @Modifying
    @Query("UPDATE refresh_tokens SET revoked = true WHERE user_id = :userId")
    Mono<Long> revokeAllByUserId(Long userId);

    @Modifying
    @Query("DELETE FROM refresh_tokens WHERE expires_at < :now")
    Mono<Long> deleteExpired(LocalDateTime now);

    @Modifying
    @Query("DELETE FROM refresh_tokens WHERE user_id = :userId")
    Mono<Long> deleteByUserId(Long userId);
}
