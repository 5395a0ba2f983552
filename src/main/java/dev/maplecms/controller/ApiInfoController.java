package dev.maplecms.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * API information and health endpoints.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "API information and version")
@Slf4j
public class ApiInfoController {

    private final String appVersion;
    private final Instant startTime = Instant.now();

    @Value("${app.name:MapleCMS API}")
    private String appName;

    public ApiInfoController(
            @Autowired(required = false) BuildProperties buildProperties,
            @Value("${app.version:1.0.0}") String fallbackVersion) {
        if (buildProperties != null) {
            this.appVersion = buildProperties.getVersion();
        } else {
            log.info("BuildProperties not available, using fallback version");
            this.appVersion = fallbackVersion;
        }
    }

    @GetMapping
    @Operation(summary = "API root")
    public Mono<Map<String, Object>> getApiInfo() {
        return Mono.just(Map.of(
                "name", appName,
                "version", appVersion,
                "endpoints", Map.of(
                        "articles", "/api/v1/articles",
                        "categories", "/api/v1/categories",
                        "tags", "/api/v1/tags",
                        "auth", "/api/v1/auth"
                ),
                "documentation", "/swagger-ui.html"
        ));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check")
    public Mono<Map<String, Object>> healthCheck() {
        return Mono.just(Map.of(
                "status", "UP",
                "timestamp", LocalDateTime.now().toString(),
                "uptime", formatDuration(Duration.between(startTime, Instant.now()))
        ));
    }

    @GetMapping("/version")
    @Operation(summary = "API version")
    public Mono<Map<String, Object>> getVersion() {
        return Mono.just(Map.of("name", appName, "version", appVersion));
    }

    static String formatDuration(Duration duration) {
        long days = duration.toDays();
        long hours = duration.toHours() % 24;
        long minutes = duration.toMinutes() % 60;
        long seconds = duration.getSeconds() % 60;

        StringBuilder sb = new StringBuilder();
        if (days > 0) sb.append(days).append("d ");
        if (hours > 0) sb.append(hours).append("h ");
        if (minutes > 0) sb.append(minutes).append("m ");
        sb.append(seconds).append("s");
        return sb.toString();
    }
}
