package dev.maplecms.controller;

import dev.maplecms.dto.LoginRequest;
import dev.maplecms.dto.RefreshRequest;
import dev.maplecms.dto.RegisterRequest;
import dev.maplecms.dto.TokenResponse;
import dev.maplecms.service.AuthService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthService authService;

    @InjectMocks
    private AuthController controller;

    private final TokenResponse tokens = TokenResponse.builder()
            .accessToken("access")
            .refreshToken("refresh")
            .expiresIn(900)
            .role("AUTHOR")
            .build();

    @Test
    void registerShouldAnswer201() {
        RegisterRequest request = new RegisterRequest("alice", "alice@example.com", "password123");
        when(authService.register(request)).thenReturn(Mono.just(tokens));

        StepVerifier.create(controller.register(request))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                    assertThat(response.getBody().getTokenType()).isEqualTo("Bearer");
                })
                .verifyComplete();
    }

    @Test
    void loginShouldReturnTokens() {
        LoginRequest request = new LoginRequest("alice@example.com", "password123");
        when(authService.login(request)).thenReturn(Mono.just(tokens));

        StepVerifier.create(controller.login(request))
                .expectNext(tokens)
                .verifyComplete();
    }

    @Test
    void refreshShouldPassTheToken() {
        when(authService.refresh("refresh")).thenReturn(Mono.just(tokens));

        StepVerifier.create(controller.refresh(new RefreshRequest("refresh")))
                .expectNext(tokens)
                .verifyComplete();
    }

    @Test
    void logoutShouldConfirm() {
        when(authService.logout("refresh")).thenReturn(Mono.empty());

        StepVerifier.create(controller.logout(new RefreshRequest("refresh")))
                .assertNext(message -> assertThat(message.getMessage()).isEqualTo("Logged out"))
                .verifyComplete();

        verify(authService).logout("refresh");
    }
}
