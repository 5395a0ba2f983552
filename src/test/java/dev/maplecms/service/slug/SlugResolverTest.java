package dev.maplecms.service.slug;

import dev.maplecms.config.SlugProperties;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleRepository;
import dev.maplecms.repository.CategoryRepository;
import dev.maplecms.repository.TagRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlugResolverTest {

    @Mock private ArticleRepository articleRepository;
    @Mock private CategoryRepository categoryRepository;
    @Mock private TagRepository tagRepository;

    private SimpleMeterRegistry meterRegistry;
    private SlugResolver slugResolver;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        slugResolver = new SlugResolver(articleRepository, categoryRepository, tagRepository,
                new SlugProperties(5, 2), new ContentMetrics(meterRegistry));
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @ParameterizedTest
        @CsvSource({
                "Hello World, hello-world",
                "'  hello   world  ', hello-world",
                "Crème Brûlée, creme-brulee",
                "C++ & Java!, c-java",
                "Spring_Boot 3.3, spring-boot-3-3"
        })
        @DisplayName("Should produce lowercase ASCII with single hyphens")
        void shouldNormalize(String input, String expected) {
            assertThat(SlugResolver.normalize(input, 80)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should fall back to 'untitled' when nothing survives")
        void shouldFallBackWhenEmpty() {
            assertThat(SlugResolver.normalize("!!! ???", 80)).isEqualTo("untitled");
            assertThat(SlugResolver.normalize("", 80)).isEqualTo("untitled");
            assertThat(SlugResolver.normalize(null, 80)).isEqualTo("untitled");
        }

        @Test
        @DisplayName("Should cap length without leaving a trailing hyphen")
        void shouldCapLength() {
            String slug = SlugResolver.normalize("abcd efgh", 5);
            assertThat(slug).isEqualTo("abcd");
        }
    }

    @Nested
    @DisplayName("candidate")
    class Candidate {

        @Test
        @DisplayName("Should return the base for the first attempt")
        void shouldReturnBase() {
            assertThat(SlugResolver.candidate("hello-world", 1, 64)).isEqualTo("hello-world");
        }

        @Test
        @DisplayName("Should append the attempt number afterwards")
        void shouldAppendSuffix() {
            assertThat(SlugResolver.candidate("hello-world", 2, 64)).isEqualTo("hello-world-2");
            assertThat(SlugResolver.candidate("hello-world", 17, 64)).isEqualTo("hello-world-17");
        }

        @Test
        @DisplayName("Should truncate the base so the suffix fits")
        void shouldTruncateBase() {
            String candidate = SlugResolver.candidate("abcdefghij", 2, 10);
            assertThat(candidate).isEqualTo("abcdefgh-2").hasSize(10);
        }

        @Test
        @DisplayName("Should not leave a double hyphen after truncation")
        void shouldRetrimAfterTruncation() {
            assertThat(SlugResolver.candidate("abcdefg-ij", 2, 10)).isEqualTo("abcdefg-2");
        }
    }

    @Nested
    @DisplayName("resolveSlug")
    class ResolveSlug {

        @Test
        @DisplayName("Should use the base when it is free")
        void shouldUseFreeBase() {
            when(tagRepository.findIdBySlug("hello-world")).thenReturn(Mono.empty());

            StepVerifier.create(slugResolver.resolveSlug(EntityType.TAG, "Hello World", null))
                    .expectNext("hello-world")
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should take the first free numbered variant")
        void shouldTakeFirstFreeVariant() {
            when(articleRepository.findIdBySlug("hello-world")).thenReturn(Mono.just(1L));
            when(articleRepository.findIdBySlug("hello-world-2")).thenReturn(Mono.empty());

            StepVerifier.create(slugResolver.resolveSlug(EntityType.ARTICLE, "Hello World", null))
                    .expectNext("hello-world-2")
                    .verifyComplete();

            assertThat(meterRegistry.counter("cms.slug.collisions").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep a slug owned by the excluded entity")
        void shouldKeepOwnSlug() {
            when(categoryRepository.findIdBySlug("news")).thenReturn(Mono.just(7L));

            StepVerifier.create(slugResolver.resolveSlug(EntityType.CATEGORY, "News", 7L))
                    .expectNext("news")
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with conflict when every attempt is taken")
        void shouldFailWhenExhausted() {
            when(tagRepository.findIdBySlug(anyString())).thenReturn(Mono.just(99L));

            StepVerifier.create(slugResolver.resolveSlug(EntityType.TAG, "java", null))
                    .expectError(DuplicateResourceException.class)
                    .verify();

            verify(tagRepository, times(5)).findIdBySlug(anyString());
            assertThat(meterRegistry.counter("cms.slug.exhausted").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("requiresNewSlug")
    class RequiresNewSlug {

        @Test
        @DisplayName("Should keep the slug when the base does not change")
        void shouldKeepSameBase() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "hello   world", "Hello World", "hello-world")).isFalse();
        }

        @Test
        @DisplayName("Should keep a numbered variant of the same base")
        void shouldKeepNumberedVariant() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "Hello, World!", "Hello World", "hello-world-3")).isFalse();
        }

        @Test
        @DisplayName("Should re-slug when the base changes")
        void shouldReslugOnBaseChange() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "Goodbye World", "Hello World", "hello-world")).isTrue();
        }

        @Test
        @DisplayName("Should re-slug when the title merely ends with a number")
        void shouldNotTreatTitleNumberAsSuffix() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "Release", "Release 1", "release-1")).isTrue();
        }

        @Test
        @DisplayName("Should re-slug when the number came from the previous name")
        void shouldReslugWhenNumberBelongedToName() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "Version", "Version 2", "version-2")).isTrue();
        }

        @Test
        @DisplayName("Should keep a collision suffix added on top of a numbered name")
        void shouldKeepSuffixOfNumberedName() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "version 2", "Version 2", "version-2-2")).isFalse();
        }

        @Test
        @DisplayName("Should keep the collision suffix when the previous name is unknown")
        void shouldKeepSuffixWithoutPreviousName() {
            assertThat(slugResolver.requiresNewSlug(EntityType.ARTICLE, "Version", null, "version-2")).isFalse();
        }

        @Test
        @DisplayName("Should re-slug when there is no current slug")
        void shouldReslugWithoutCurrent() {
            assertThat(slugResolver.requiresNewSlug(EntityType.TAG, "java", "Java", null)).isTrue();
        }
    }

    @Nested
    @DisplayName("retryOnSlugConflict")
    class RetryOnSlugConflict {

        @Test
        @DisplayName("Should re-run the unit after a slug violation")
        void shouldRetryOnSlugViolation() {
            AtomicInteger attempts = new AtomicInteger();
            Mono<String> unit = Mono.defer(() -> attempts.incrementAndGet() == 1
                    ? Mono.error(new DataIntegrityViolationException(
                            "duplicate key value violates unique constraint \"uq_tags_slug\""))
                    : Mono.just("java-2"));

            StepVerifier.create(slugResolver.retryOnSlugConflict(EntityType.TAG, unit))
                    .expectNext("java-2")
                    .verifyComplete();

            assertThat(attempts).hasValue(2);
            assertThat(meterRegistry.counter("cms.slug.write.retries").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should surface conflict once retries are exhausted")
        void shouldSurfaceConflict() {
            AtomicInteger attempts = new AtomicInteger();
            Mono<String> unit = Mono.defer(() -> {
                attempts.incrementAndGet();
                return Mono.error(new DataIntegrityViolationException("violates UQ_ARTICLES_SLUG"));
            });

            StepVerifier.create(slugResolver.retryOnSlugConflict(EntityType.ARTICLE, unit))
                    .expectErrorSatisfies(ex -> {
                        assertThat(ex).isInstanceOf(DuplicateResourceException.class);
                        assertThat(ex.getMessage()).isEqualTo("error.slug_conflict");
                    })
                    .verify();

            assertThat(attempts).hasValue(3);
        }

        @Test
        @DisplayName("Should not retry other constraint violations")
        void shouldNotRetryOtherViolations() {
            AtomicInteger attempts = new AtomicInteger();
            Mono<String> unit = Mono.defer(() -> {
                attempts.incrementAndGet();
                return Mono.error(new DataIntegrityViolationException("violates uq_tags_name"));
            });

            StepVerifier.create(slugResolver.retryOnSlugConflict(EntityType.TAG, unit))
                    .expectError(DataIntegrityViolationException.class)
                    .verify();

            assertThat(attempts).hasValue(1);
        }
    }

    @Test
    @DisplayName("isSlugViolation should inspect the cause chain")
    void shouldFindViolationInCause() {
        RuntimeException wrapped = new RuntimeException("tx failed",
                new DataIntegrityViolationException("unique constraint uq_categories_slug"));

        assertThat(SlugResolver.isSlugViolation(EntityType.CATEGORY, wrapped)).isTrue();
        assertThat(SlugResolver.isSlugViolation(EntityType.TAG, wrapped)).isFalse();
    }
}
