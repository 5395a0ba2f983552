package dev.maplecms.config;

import dev.maplecms.entity.User;
import dev.maplecms.entity.UserRole;
import dev.maplecms.repository.UserRepository;
import dev.maplecms.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Seeds the first administrator from {@code admin.*} properties when no account with that
 * email exists yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminUserInitializer {

    private final UserRepository userRepository;
    private final UserService userService;

    @Value("${admin.email:}")
    private String adminEmail;

    @Value("${admin.password:}")
    private String adminPassword;

    @Value("${admin.username:admin}")
    private String adminUsername;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeAdminUser() {
        seedAdmin().subscribe(
                user -> log.info("Admin user created: {}", maskEmail(user.getEmail())),
                error -> log.error("Failed to initialize admin user: {}", error.getMessage())
        );
    }

    Mono<User> seedAdmin() {
        if (adminEmail == null || adminEmail.isBlank() || adminPassword == null || adminPassword.isBlank()) {
            log.debug("Admin initialization skipped: admin.email and admin.password not configured");
            return Mono.empty();
        }
        if (adminPassword.length() < 8) {
            log.warn("Admin password is shorter than 8 characters, skipping admin creation");
            return Mono.empty();
        }
        return userRepository.existsByEmail(adminEmail)
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Admin user already exists: {}", maskEmail(adminEmail));
                        return Mono.empty();
                    }
                    return userService.insertUser(adminUsername, adminEmail, adminPassword, UserRole.ADMIN, true);
                });
    }

    private static String maskEmail(String email) {
        if (email == null) return "***";
        int atIdx = email.indexOf('@');
        if (atIdx < 0) return "***";
        return email.substring(0, Math.min(3, atIdx)) + "***@" + email.substring(atIdx + 1);
    }
}
