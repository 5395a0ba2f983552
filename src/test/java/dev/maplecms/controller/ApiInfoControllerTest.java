package dev.maplecms.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ApiInfoControllerTest {

    private ApiInfoController controller;

    @BeforeEach
    void setUp() {
        controller = new ApiInfoController(null, "2.0.0");
        ReflectionTestUtils.setField(controller, "appName", "MapleCMS API");
    }

    @Test
    void shouldFallBackToConfiguredVersion() {
        StepVerifier.create(controller.getVersion())
                .assertNext(body -> {
                    assertThat(body).containsEntry("version", "2.0.0");
                    assertThat(body).containsEntry("name", "MapleCMS API");
                })
                .verifyComplete();
    }

    @Test
    void shouldListEndpoints() {
        StepVerifier.create(controller.getApiInfo())
                .assertNext(body -> assertThat(body).containsKeys("endpoints", "documentation"))
                .verifyComplete();
    }

    @Test
    void healthShouldReportUp() {
        StepVerifier.create(controller.healthCheck())
                .assertNext(body -> {
                    assertThat(body).containsEntry("status", "UP");
                    assertThat(body).containsKey("uptime");
                })
                .verifyComplete();
    }

    @Test
    void shouldFormatDurations() {
        assertThat(ApiInfoController.formatDuration(Duration.ofSeconds(5))).isEqualTo("5s");
        assertThat(ApiInfoController.formatDuration(Duration.ofSeconds(3_725))).isEqualTo("1h 2m 5s");
        assertThat(ApiInfoController.formatDuration(Duration.ofDays(2).plusSeconds(1))).isEqualTo("2d 1s");
    }
}
