package dev.maplecms.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.maplecms.entity.User;
import dev.maplecms.entity.UserRole;
import dev.maplecms.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Authenticates requests carrying a Bearer access token.
 *
 * <p>The role is taken from the stored user, not from the token, so demotions and
 * deactivations apply within the user-cache TTL. A user is granted its own role and every
 * role below it ({@code ROLE_EDITOR} implies {@code ROLE_AUTHOR} and {@code ROLE_VIEWER}).</p>
 */
@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    private static final String AUTH_PATH_PREFIX = "/api/v1/auth/";

    private final JwtTokenProvider tokenProvider;
    private final UserRepository userRepository;

    private final Cache<String, User> userCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, UserRepository userRepository) {
        this.tokenProvider = tokenProvider;
        this.userRepository = userRepository;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = extractBearerToken(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            // A stale token must not block logging in again
            if (path.startsWith(AUTH_PATH_PREFIX)) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: {} for path {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        String email = validation.claims().getSubject();
        User cached = userCache.getIfPresent(email);
        Mono<User> userMono = cached != null
                ? Mono.just(cached)
                : userRepository.findByEmail(email).doOnNext(user -> userCache.put(email, user));

        return userMono
                .filter(user -> Boolean.TRUE.equals(user.getActive()) && UserRole.fromString(user.getRole()) != null)
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Access denied: user {} not found, inactive or without a valid role", email);
                    return unauthorizedResponse(exchange, "User not found or inactive").then(Mono.empty());
                }))
                .flatMap(user -> {
                    var auth = new UsernamePasswordAuthenticationToken(email, null, authoritiesFor(user.getRole()));
                    log.debug("Authenticated {} as {}", email, user.getRole());
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                });
    }

    /**
     * Drop a cached user so the next request reloads it (after role, status or email changes).
     */
    public void evict(String email) {
        userCache.invalidate(email);
    }

    static List<GrantedAuthority> authoritiesFor(String role) {
        return Arrays.stream(UserRole.values())
                .filter(candidate -> candidate.isSatisfiedBy(role))
                .map(candidate -> new SimpleGrantedAuthority("ROLE_" + candidate.name()))
                .collect(Collectors.toList());
    }

    private String extractBearerToken(ServerWebExchange exchange) {
        String header = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(header) && header.startsWith("Bearer ")) {
            return header.substring(7);
        }
        return null;
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"" + message.replace("\"", "\\\"") + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
