package dev.maplecms.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds for slug resolution.
 *
 * @param maxAttempts  candidate slugs probed before giving up with a conflict
 * @param writeRetries times a create/update unit is re-run after losing a slug race at commit
 */
@Validated
@ConfigurationProperties(prefix = "app.slug")
public record SlugProperties(
        @DefaultValue("50") @Min(1) int maxAttempts,
        @DefaultValue("3") @Min(0) int writeRetries
) {
}
