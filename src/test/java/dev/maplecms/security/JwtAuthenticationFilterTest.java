package dev.maplecms.security;

import dev.maplecms.entity.User;
import dev.maplecms.repository.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private JwtTokenProvider tokenProvider;

    @Mock
    private UserRepository userRepository;

    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(tokenProvider, userRepository);
    }

    private static MockServerWebExchange exchangeWithToken(String path, String token) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }

    private static JwtTokenProvider.TokenValidationResult validFor(String email) {
        Claims claims = Jwts.claims().subject(email).build();
        return JwtTokenProvider.TokenValidationResult.success(claims);
    }

    private static User user(String email, String role, boolean active) {
        return User.builder().id(1L).email(email).username("u").role(role).active(active).build();
    }

    @Nested
    @DisplayName("authoritiesFor")
    class Authorities {

        @Test
        @DisplayName("Editor should also hold author and viewer authorities")
        void editorImpliesLowerRoles() {
            assertThat(JwtAuthenticationFilter.authoritiesFor("EDITOR"))
                    .extracting(GrantedAuthority::getAuthority)
                    .containsExactlyInAnyOrder("ROLE_EDITOR", "ROLE_AUTHOR", "ROLE_VIEWER");
        }

        @Test
        @DisplayName("Viewer should hold only its own authority")
        void viewerIsLowest() {
            assertThat(JwtAuthenticationFilter.authoritiesFor("VIEWER"))
                    .extracting(GrantedAuthority::getAuthority)
                    .containsExactly("ROLE_VIEWER");
        }

        @Test
        @DisplayName("Unknown role should grant nothing")
        void unknownRole() {
            assertThat(JwtAuthenticationFilter.authoritiesFor("ROOT")).isEmpty();
        }
    }

    @Test
    @DisplayName("Request without a token should pass through untouched")
    void shouldPassAnonymousRequest() {
        var exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/articles"));
        WebFilterChain chain = ex -> Mono.empty();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        verifyNoInteractions(tokenProvider, userRepository);
    }

    @Test
    @DisplayName("Invalid token on a protected path should be answered with 401")
    void shouldRejectInvalidToken() {
        var exchange = exchangeWithToken("/api/v1/users", "bad");
        when(tokenProvider.validateAndParseClaims("bad"))
                .thenReturn(JwtTokenProvider.TokenValidationResult.invalid("Invalid token"));
        WebFilterChain chain = mock(WebFilterChain.class);

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verifyNoInteractions(chain);
    }

    @Test
    @DisplayName("Invalid token on an auth path should not block login")
    void shouldIgnoreInvalidTokenOnAuthPath() {
        var exchange = exchangeWithToken("/api/v1/auth/login", "stale");
        when(tokenProvider.validateAndParseClaims("stale"))
                .thenReturn(JwtTokenProvider.TokenValidationResult.expired("Token expired"));
        WebFilterChain chain = ex -> Mono.empty();

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isNull();
    }

    @Test
    @DisplayName("Valid token should authenticate with the stored role and cache the user")
    void shouldAuthenticateWithStoredRole() {
        when(tokenProvider.validateAndParseClaims(anyString())).thenReturn(validFor("ed@example.com"));
        when(userRepository.findByEmail("ed@example.com")).thenReturn(Mono.just(user("ed@example.com", "EDITOR", true)));

        AtomicReference<String> seenRoles = new AtomicReference<>();
        WebFilterChain chain = ex -> ReactiveSecurityContextHolder.getContext()
                .doOnNext(ctx -> seenRoles.set(ctx.getAuthentication().getAuthorities().toString()))
                .then();

        StepVerifier.create(filter.filter(exchangeWithToken("/api/v1/categories", "t1"), chain)).verifyComplete();
        StepVerifier.create(filter.filter(exchangeWithToken("/api/v1/categories", "t2"), chain)).verifyComplete();

        assertThat(seenRoles.get()).contains("ROLE_EDITOR", "ROLE_AUTHOR");
        verify(userRepository, times(1)).findByEmail("ed@example.com");
    }

    @Test
    @DisplayName("Evicted user should be reloaded on the next request")
    void shouldReloadAfterEvict() {
        when(tokenProvider.validateAndParseClaims(anyString())).thenReturn(validFor("ed@example.com"));
        when(userRepository.findByEmail("ed@example.com")).thenReturn(Mono.just(user("ed@example.com", "EDITOR", true)));
        WebFilterChain chain = ex -> Mono.empty();

        StepVerifier.create(filter.filter(exchangeWithToken("/api/v1/tags", "t"), chain)).verifyComplete();
        filter.evict("ed@example.com");
        StepVerifier.create(filter.filter(exchangeWithToken("/api/v1/tags", "t"), chain)).verifyComplete();

        verify(userRepository, times(2)).findByEmail("ed@example.com");
    }

    @Test
    @DisplayName("Inactive user should be answered with 401")
    void shouldRejectInactiveUser() {
        var exchange = exchangeWithToken("/api/v1/articles", "t");
        when(tokenProvider.validateAndParseClaims("t")).thenReturn(validFor("gone@example.com"));
        when(userRepository.findByEmail("gone@example.com")).thenReturn(Mono.just(user("gone@example.com", "AUTHOR", false)));
        WebFilterChain chain = mock(WebFilterChain.class);

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verifyNoInteractions(chain);
    }
}
