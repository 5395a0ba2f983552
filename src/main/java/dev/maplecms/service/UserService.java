package dev.maplecms.service;

import dev.maplecms.dto.PageResponse;
import dev.maplecms.dto.UserRequest;
import dev.maplecms.dto.UserResponse;
import dev.maplecms.dto.UserUpdateRequest;
import dev.maplecms.entity.User;
import dev.maplecms.entity.UserRole;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.exception.ReferentialViolationException;
import dev.maplecms.exception.ResourceNotFoundException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleRepository;
import dev.maplecms.repository.RefreshTokenRepository;
import dev.maplecms.repository.UserRepository;
import dev.maplecms.security.JwtAuthenticationFilter;
import dev.maplecms.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private static final String USERNAME_CONSTRAINT = "uq_users_username";
    private static final String EMAIL_CONSTRAINT = "uq_users_email";

    private final UserRepository userRepository;
    private final ArticleRepository articleRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final PasswordEncoder passwordEncoder;
    private final IdService idService;
    private final ContentMetrics metrics;
    private final JwtAuthenticationFilter jwtAuthenticationFilter;

    public Mono<UserResponse> getUserById(Long id) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)))
                .map(UserResponse::fromEntity);
    }

    public Mono<PageResponse<UserResponse>> listUsers(long skip, int limit) {
        return Mono.zip(
                userRepository.findAllPaged(limit, skip).map(UserResponse::fromEntity).collectList(),
                userRepository.countAll()
        ).map(tuple -> PageResponse.of(tuple.getT1(), skip, limit, tuple.getT2()));
    }

    public Mono<UserResponse> getCurrentUser(String email) {
        return findByEmail(email).map(UserResponse::fromEntity);
    }

    /**
     * The user behind an authenticated principal.
     */
    public Mono<User> findByEmail(String email) {
        return userRepository.findByEmail(email)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "email", email)));
    }

    @Transactional
    public Mono<UserResponse> createUser(UserRequest request) {
        UserRole role = request.getRole() != null ? UserRole.fromString(request.getRole()) : UserRole.AUTHOR;
        if (role == null) {
            return Mono.error(new IllegalArgumentException("error.invalid_role"));
        }
        boolean active = request.getActive() == null || request.getActive();
        return insertUser(request.getUsername(), request.getEmail(), request.getPassword(), role, active)
                .map(UserResponse::fromEntity);
    }

    /**
     * Insert a user after checking that neither username nor email is taken. Nothing is
     * written when either check fails.
     */
    @Transactional
    public Mono<User> insertUser(String username, String email, String rawPassword, UserRole role, boolean active) {
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        String trimmedUsername = username.trim();

        return ensureEmailAvailable(normalizedEmail, null)
                .then(Mono.defer(() -> ensureUsernameAvailable(trimmedUsername, null)))
                .then(encode(rawPassword))
                .flatMap(hash -> {
                    LocalDateTime now = Timestamps.now();
                    return userRepository.save(User.builder()
                            .id(idService.nextId())
                            .username(trimmedUsername)
                            .email(normalizedEmail)
                            .passwordHash(hash)
                            .role(role.name())
                            .active(active)
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                })
                .onErrorMap(DataIntegrityViolationException.class,
                        ex -> translateUniqueViolation(ex, trimmedUsername, normalizedEmail))
                .doOnSuccess(user -> {
                    metrics.entityCreated("user");
                    log.info("User created: {} ({})", user.getUsername(), user.getRole());
                });
    }

    /**
     * Admin update: every non-null field of {@code request} is applied, including role and
     * the active flag.
     */
    @Transactional
    public Mono<UserResponse> updateUser(Long id, UserUpdateRequest request) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)))
                .flatMap(user -> applyUpdate(user, request, true))
                .map(UserResponse::fromEntity);
    }

    /**
     * Self-service update through {@code /users/me}. Role and active flag are not writable here.
     */
    @Transactional
    public Mono<UserResponse> updateCurrentUser(String email, UserUpdateRequest request) {
        return findByEmail(email)
                .flatMap(user -> applyUpdate(user, request, false))
                .map(UserResponse::fromEntity);
    }

    /**
     * Delete a user. Refused while the user still authors articles; otherwise their refresh
     * tokens are removed with them.
     */
    @Transactional
    public Mono<Void> deleteUser(Long id, String currentUserEmail) {
        return userRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", id)))
                .flatMap(user -> {
                    if (currentUserEmail != null && currentUserEmail.equalsIgnoreCase(user.getEmail())) {
                        return Mono.error(new IllegalArgumentException("error.cannot_delete_self"));
                    }
                    return articleRepository.countByAuthorId(id)
                            .flatMap(articles -> {
                                if (articles > 0) {
                                    log.warn("Refusing to delete user {}: {} authored articles", id, articles);
                                    return Mono.error(new ReferentialViolationException("User", id, articles + " article(s)"));
                                }
                                return refreshTokenRepository.deleteByUserId(id)
                                        .then(userRepository.deleteById(id))
                                        .doOnSuccess(v -> {
                                            jwtAuthenticationFilter.evict(user.getEmail());
                                            metrics.entityDeleted("user");
                                            log.info("User deleted: {} ({})", id, user.getUsername());
                                        });
                            });
                });
    }

    private Mono<User> applyUpdate(User user, UserUpdateRequest request, boolean privileged) {
        String previousEmail = user.getEmail();
        Mono<Void> checks = Mono.empty();
        if (request.getEmail() != null) {
            String newEmail = request.getEmail().trim().toLowerCase(Locale.ROOT);
            checks = checks.then(ensureEmailAvailable(newEmail, user.getId()))
                    .doOnSuccess(v -> user.setEmail(newEmail));
        }
        if (request.getUsername() != null) {
            String newUsername = request.getUsername().trim();
            checks = checks.then(ensureUsernameAvailable(newUsername, user.getId()))
                    .doOnSuccess(v -> user.setUsername(newUsername));
        }
        if (request.getPassword() != null) {
            checks = checks.then(encode(request.getPassword()).doOnNext(user::setPasswordHash).then());
        }
        if (privileged) {
            if (request.getRole() != null) {
                UserRole role = UserRole.fromString(request.getRole());
                if (role == null) {
                    return Mono.error(new IllegalArgumentException("error.invalid_role"));
                }
                user.setRole(role.name());
            }
            if (request.getActive() != null) {
                user.setActive(request.getActive());
            }
        }

        return checks
                .then(Mono.defer(() -> {
                    user.setUpdatedAt(Timestamps.now());
                    return userRepository.save(user);
                }))
                .onErrorMap(DataIntegrityViolationException.class,
                        ex -> translateUniqueViolation(ex, user.getUsername(), user.getEmail()))
                .doOnSuccess(saved -> {
                    jwtAuthenticationFilter.evict(previousEmail);
                    log.info("User updated: {}", saved.getId());
                });
    }

    /**
     * Map a unique violation that slipped past the pre-checks (a concurrent writer) to the
     * field whose constraint fired. Other integrity violations are left as they are.
     */
    static Throwable translateUniqueViolation(DataIntegrityViolationException ex, String username, String email) {
        Throwable current = ex;
        while (current != null) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains(USERNAME_CONSTRAINT)) {
                    return new DuplicateResourceException("User", "username", username, ex);
                }
                if (lower.contains(EMAIL_CONSTRAINT)) {
                    return new DuplicateResourceException("User", "email", email, ex);
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return ex;
    }

    private Mono<Void> ensureEmailAvailable(String email, Long excludeId) {
        return userRepository.findByEmail(email)
                .filter(existing -> !existing.getId().equals(excludeId))
                .flatMap(existing -> Mono.<Void>error(new DuplicateResourceException("User", "email", email)))
                .then();
    }

    private Mono<Void> ensureUsernameAvailable(String username, Long excludeId) {
        return userRepository.findByUsername(username)
                .filter(existing -> !existing.getId().equals(excludeId))
                .flatMap(existing -> Mono.<Void>error(new DuplicateResourceException("User", "username", username)))
                .then();
    }

    // BCrypt is CPU-bound; keep it off the event loop
    private Mono<String> encode(String rawPassword) {
        return Mono.fromCallable(() -> passwordEncoder.encode(rawPassword))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
