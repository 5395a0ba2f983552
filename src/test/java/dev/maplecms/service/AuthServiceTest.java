package dev.maplecms.service;

import dev.maplecms.dto.LoginRequest;
import dev.maplecms.dto.RegisterRequest;
import dev.maplecms.entity.RefreshToken;
import dev.maplecms.entity.User;
import dev.maplecms.entity.UserRole;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.UserRepository;
import dev.maplecms.security.JwtTokenProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock private UserRepository userRepository;
    @Mock private UserService userService;
    @Mock private RefreshTokenService refreshTokenService;
    @Mock private JwtTokenProvider tokenProvider;
    @Mock private PasswordEncoder passwordEncoder;

    private SimpleMeterRegistry meterRegistry;
    private AuthService authService;
    private User alice;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        authService = new AuthService(userRepository, userService, refreshTokenService, tokenProvider,
                passwordEncoder, new ContentMetrics(meterRegistry));

        alice = User.builder()
                .id(10L)
                .username("alice")
                .email("alice@example.com")
                .passwordHash("$2a$12$hash")
                .role("AUTHOR")
                .active(true)
                .build();
    }

    private RefreshToken issued(String plain) {
        return RefreshToken.builder().id(900L).userId(10L).token(plain).build();
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("Should return access and refresh tokens")
        void shouldLogin() {
            when(userRepository.findByEmail("alice@example.com")).thenReturn(Mono.just(alice));
            when(passwordEncoder.matches("password1", "$2a$12$hash")).thenReturn(true);
            when(refreshTokenService.createRefreshToken(10L)).thenReturn(Mono.just(issued("refresh-1")));
            when(tokenProvider.generateToken("alice@example.com", "AUTHOR")).thenReturn("access-1");
            when(tokenProvider.getExpirationSeconds()).thenReturn(900L);

            StepVerifier.create(authService.login(new LoginRequest("Alice@Example.com", "password1")))
                    .assertNext(tokens -> {
                        assertThat(tokens.getAccessToken()).isEqualTo("access-1");
                        assertThat(tokens.getRefreshToken()).isEqualTo("refresh-1");
                        assertThat(tokens.getTokenType()).isEqualTo("Bearer");
                        assertThat(tokens.getExpiresIn()).isEqualTo(900L);
                        assertThat(tokens.getRole()).isEqualTo("AUTHOR");
                    })
                    .verifyComplete();

            assertThat(meterRegistry.counter("cms.auth.logins", "result", "success").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a wrong password")
        void shouldRejectWrongPassword() {
            when(userRepository.findByEmail("alice@example.com")).thenReturn(Mono.just(alice));
            when(passwordEncoder.matches("wrong", "$2a$12$hash")).thenReturn(false);

            StepVerifier.create(authService.login(new LoginRequest("alice@example.com", "wrong")))
                    .expectErrorMessage("error.invalid_credentials")
                    .verify();

            verifyNoInteractions(refreshTokenService);
            assertThat(meterRegistry.counter("cms.auth.logins", "result", "failure").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject an unknown email the same way")
        void shouldRejectUnknownEmail() {
            when(userRepository.findByEmail("ghost@example.com")).thenReturn(Mono.empty());

            StepVerifier.create(authService.login(new LoginRequest("ghost@example.com", "password1")))
                    .expectError(BadCredentialsException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should reject an inactive user")
        void shouldRejectInactiveUser() {
            alice.setActive(false);
            when(userRepository.findByEmail("alice@example.com")).thenReturn(Mono.just(alice));
            when(passwordEncoder.matches("password1", "$2a$12$hash")).thenReturn(true);

            StepVerifier.create(authService.login(new LoginRequest("alice@example.com", "password1")))
                    .expectErrorMessage("error.account_disabled")
                    .verify();

            verifyNoInteractions(refreshTokenService);
        }
    }

    @Test
    @DisplayName("register should create an AUTHOR and sign it in")
    void shouldRegisterAsAuthor() {
        when(userService.insertUser("alice", "alice@example.com", "password1", UserRole.AUTHOR, true))
                .thenReturn(Mono.just(alice));
        when(refreshTokenService.createRefreshToken(10L)).thenReturn(Mono.just(issued("refresh-1")));
        when(tokenProvider.generateToken("alice@example.com", "AUTHOR")).thenReturn("access-1");

        StepVerifier.create(authService.register(new RegisterRequest("alice", "alice@example.com", "password1")))
                .assertNext(tokens -> assertThat(tokens.getUsername()).isEqualTo("alice"))
                .verifyComplete();
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        @DisplayName("Should return the rotated refresh token")
        void shouldRefresh() {
            when(refreshTokenService.verifyAndRotate("refresh-1")).thenReturn(Mono.just(issued("refresh-2")));
            when(userRepository.findById(10L)).thenReturn(Mono.just(alice));
            when(tokenProvider.generateToken("alice@example.com", "AUTHOR")).thenReturn("access-2");

            StepVerifier.create(authService.refresh("refresh-1"))
                    .assertNext(tokens -> {
                        assertThat(tokens.getAccessToken()).isEqualTo("access-2");
                        assertThat(tokens.getRefreshToken()).isEqualTo("refresh-2");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should reject a token whose user is disabled")
        void shouldRejectDisabledUser() {
            alice.setActive(false);
            when(refreshTokenService.verifyAndRotate("refresh-1")).thenReturn(Mono.just(issued("refresh-2")));
            when(userRepository.findById(10L)).thenReturn(Mono.just(alice));

            StepVerifier.create(authService.refresh("refresh-1"))
                    .expectError(SecurityException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("logout should revoke the refresh token")
    void shouldLogout() {
        when(refreshTokenService.revokeToken("refresh-1")).thenReturn(Mono.empty());

        StepVerifier.create(authService.logout("refresh-1")).verifyComplete();

        verify(refreshTokenService).revokeToken("refresh-1");
    }
}
