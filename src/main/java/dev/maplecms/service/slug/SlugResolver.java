package dev.maplecms.service.slug;

import dev.maplecms.config.SlugProperties;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleRepository;
import dev.maplecms.repository.CategoryRepository;
import dev.maplecms.repository.TagRepository;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives URL slugs from display names and keeps them unique per {@link EntityType}.
 *
 * <p>The first free candidate of {@code base}, {@code base-2}, {@code base-3}, ... is taken,
 * probing at most {@code app.slug.max-attempts} candidates. A slug that is free when probed can
 * still be taken by a concurrent writer before commit; {@link #retryOnSlugConflict} re-runs the
 * whole write in that case.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SlugResolver {

    static final String FALLBACK_SLUG = "untitled";

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");
    private static final Pattern NUMBERED_SLUG = Pattern.compile("^(.+)-(\\d{1,9})$");

    private final ArticleRepository articleRepository;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;
    private final SlugProperties properties;
    private final ContentMetrics metrics;

    /**
     * Lowercase ASCII slug of {@code displayName}: diacritics dropped, every run of other
     * characters collapsed to one hyphen, no leading or trailing hyphen, at most
     * {@code maxLength} characters. Never empty.
     */
    public static String normalize(String displayName, int maxLength) {
        if (displayName == null) {
            return FALLBACK_SLUG;
        }
        String ascii = COMBINING_MARKS.matcher(Normalizer.normalize(displayName, Normalizer.Form.NFKD)).replaceAll("");
        String slug = trimHyphens(NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-"));
        if (slug.length() > maxLength) {
            slug = trimHyphens(slug.substring(0, maxLength));
        }
        return slug.isEmpty() ? FALLBACK_SLUG : slug;
    }

    /**
     * The {@code attempt}-th candidate for {@code base}: the base itself for attempt 1,
     * {@code base-N} afterwards, with the base shortened so the result fits {@code maxLength}.
     */
    static String candidate(String base, int attempt, int maxLength) {
        if (attempt <= 1) {
            return base;
        }
        String suffix = "-" + attempt;
        String stem = base;
        if (stem.length() + suffix.length() > maxLength) {
            stem = trimHyphens(stem.substring(0, maxLength - suffix.length()));
        }
        return stem + suffix;
    }

    /**
     * Find a slug for {@code displayName} that no row of {@code type} uses, other than the
     * row {@code excludeId} (the entity being updated; {@code null} on create).
     *
     * @return the slug, or {@link DuplicateResourceException} when every allowed candidate is taken
     */
    public Mono<String> resolveSlug(EntityType type, String displayName, Long excludeId) {
        int maxLength = type.getMaxSlugLength();
        String base = normalize(displayName, maxLength);

        return Flux.range(1, properties.maxAttempts())
                .map(attempt -> candidate(base, attempt, maxLength))
                .concatMap(slug -> isAvailable(type, slug, excludeId)
                        .filter(Boolean::booleanValue)
                        .map(free -> slug))
                .next()
                .doOnNext(slug -> log.debug("Resolved {} slug '{}'", type.getDisplayName(), slug))
                .switchIfEmpty(Mono.defer(() -> {
                    metrics.slugExhausted();
                    log.warn("No free {} slug for base '{}' after {} attempts",
                            type.getDisplayName(), base, properties.maxAttempts());
                    return Mono.error(new DuplicateResourceException(type.getDisplayName(), "slug", base));
                }));
    }

    /**
     * Whether renaming an entity from {@code previousDisplayName} to {@code displayName} calls
     * for a new slug. The current slug is kept when it is the new base or one of the base's
     * numbered variants. A trailing number only counts as a collision suffix when the previous
     * name did not produce it itself: "Version 2" ({@code version-2}) renamed to "Version" is
     * re-slugged.
     */
    public boolean requiresNewSlug(EntityType type, String displayName, String previousDisplayName, String currentSlug) {
        if (currentSlug == null) {
            return true;
        }
        int maxLength = type.getMaxSlugLength();
        String base = normalize(displayName, maxLength);
        if (currentSlug.equals(base)) {
            return false;
        }
        if (previousDisplayName != null && currentSlug.equals(normalize(previousDisplayName, maxLength))) {
            return true;
        }
        Matcher matcher = NUMBERED_SLUG.matcher(currentSlug);
        if (matcher.matches()) {
            int n = Integer.parseInt(matcher.group(2));
            return n < 2 || !candidate(base, n, type.getMaxSlugLength()).equals(currentSlug);
        }
        return true;
    }

    /**
     * Re-subscribe {@code transactionalUnit} when it fails on the slug unique constraint of
     * {@code type}, up to {@code app.slug.write-retries} times. The unit must resolve its slug
     * inside itself so every attempt sees the latest committed rows.
     */
    public <T> Mono<T> retryOnSlugConflict(EntityType type, Mono<T> transactionalUnit) {
        int retries = properties.writeRetries();
        return transactionalUnit
                .retryWhen(Retry.max(retries)
                        .filter(ex -> isSlugViolation(type, ex))
                        .doBeforeRetry(signal -> {
                            metrics.slugWriteRetry();
                            log.warn("{} slug taken at commit, retrying ({}/{})",
                                    type.getDisplayName(), signal.totalRetries() + 1, retries);
                        })
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .onErrorMap(ex -> isSlugViolation(type, ex),
                        ex -> new DuplicateResourceException("error.slug_conflict", ex));
    }

    static boolean isSlugViolation(EntityType type, Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DataIntegrityViolationException
                    || current instanceof R2dbcDataIntegrityViolationException) {
                String message = current.getMessage();
                if (message != null && message.toLowerCase(Locale.ROOT).contains(type.getSlugConstraint())) {
                    return true;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private Mono<Boolean> isAvailable(EntityType type, String slug, Long excludeId) {
        return ownerOf(type, slug)
                .map(ownerId -> ownerId.equals(excludeId))
                .doOnNext(free -> {
                    if (!free) {
                        metrics.slugCollision();
                    }
                })
                .defaultIfEmpty(true);
    }

    private Mono<Long> ownerOf(EntityType type, String slug) {
        switch (type) {
            case ARTICLE:
                return articleRepository.findIdBySlug(slug);
            case CATEGORY:
                return categoryRepository.findIdBySlug(slug);
            case TAG:
                return tagRepository.findIdBySlug(slug);
            default:
                throw new IllegalStateException("Unknown slug namespace: " + type);
        }
    }

    private static String trimHyphens(String value) {
        return EDGE_HYPHENS.matcher(value).replaceAll("");
    }
}
