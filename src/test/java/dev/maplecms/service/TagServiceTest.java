package dev.maplecms.service;

import dev.maplecms.dto.TagRequest;
import dev.maplecms.entity.Tag;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.exception.ResourceNotFoundException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleTagRepository;
import dev.maplecms.repository.TagRepository;
import dev.maplecms.service.slug.EntityType;
import dev.maplecms.service.slug.SlugResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagServiceTest {

    @Mock private TagRepository tagRepository;
    @Mock private ArticleTagRepository articleTagRepository;
    @Mock private SlugResolver slugResolver;
    @Mock private TransactionalOperator transactionalOperator;
    @Mock private IdService idService;

    private SimpleMeterRegistry meterRegistry;
    private TagService tagService;
    private Tag javaTag;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tagService = new TagService(tagRepository, articleTagRepository, slugResolver,
                transactionalOperator, idService, new ContentMetrics(meterRegistry));

        lenient().when(transactionalOperator.transactional(any(Mono.class)))
                .thenAnswer(inv -> inv.getArgument(0));
        lenient().when(slugResolver.retryOnSlugConflict(eq(EntityType.TAG), any(Mono.class)))
                .thenAnswer(inv -> inv.getArgument(1));

        javaTag = Tag.builder()
                .id(101L)
                .name("Java")
                .slug("java")
                .createdAt(LocalDateTime.now().minusDays(60))
                .updatedAt(LocalDateTime.now().minusDays(60))
                .build();
        javaTag.setNewRecord(false);
    }

    @Nested
    @DisplayName("createTag")
    class CreateTag {

        @Test
        @DisplayName("Should create a tag and count it")
        void shouldCreate() {
            when(tagRepository.findIdByName("Spring Boot")).thenReturn(Mono.empty());
            when(slugResolver.resolveSlug(EntityType.TAG, "Spring Boot", null)).thenReturn(Mono.just("spring-boot"));
            when(idService.nextId()).thenReturn(102L);
            when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(tagService.createTag(new TagRequest("Spring Boot")))
                    .assertNext(response -> {
                        assertThat(response.getId()).isEqualTo("102");
                        assertThat(response.getSlug()).isEqualTo("spring-boot");
                    })
                    .verifyComplete();

            assertThat(meterRegistry.counter("cms.entities.created", "type", "tag").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a duplicate name")
        void shouldRejectDuplicate() {
            when(tagRepository.findIdByName("Java")).thenReturn(Mono.just(101L));

            StepVerifier.create(tagService.createTag(new TagRequest("Java")))
                    .expectError(DuplicateResourceException.class)
                    .verify();

            verify(tagRepository, never()).save(any(Tag.class));
        }
    }

    @Nested
    @DisplayName("updateTag")
    class UpdateTag {

        @Test
        @DisplayName("Should keep the slug when only the casing changes")
        void shouldKeepSlug() {
            when(tagRepository.findById(101L)).thenReturn(Mono.just(javaTag));
            when(tagRepository.findIdByName("JAVA")).thenReturn(Mono.just(101L));
            when(slugResolver.requiresNewSlug(EntityType.TAG, "JAVA", "Java", "java")).thenReturn(false);
            when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(tagService.updateTag(101L, new TagRequest("JAVA")))
                    .assertNext(response -> {
                        assertThat(response.getName()).isEqualTo("JAVA");
                        assertThat(response.getSlug()).isEqualTo("java");
                    })
                    .verifyComplete();

            verify(slugResolver, never()).resolveSlug(any(), anyString(), any());
        }

        @Test
        @DisplayName("Should fail with NotFound for a missing tag")
        void shouldFailWhenMissing() {
            when(tagRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(tagService.updateTag(404L, new TagRequest("Kotlin")))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("deleteTag")
    class DeleteTag {

        @Test
        @DisplayName("Should remove associations before the tag")
        void shouldDetachFirst() {
            when(tagRepository.findById(101L)).thenReturn(Mono.just(javaTag));
            when(articleTagRepository.deleteByTagId(101L)).thenReturn(Mono.just(4L));
            when(tagRepository.deleteById(101L)).thenReturn(Mono.empty());

            StepVerifier.create(tagService.deleteTag(101L)).verifyComplete();

            var inOrder = inOrder(articleTagRepository, tagRepository);
            inOrder.verify(articleTagRepository).deleteByTagId(101L);
            inOrder.verify(tagRepository).deleteById(101L);
        }

        @Test
        @DisplayName("Should fail with NotFound for a missing tag")
        void shouldFailWhenMissing() {
            when(tagRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(tagService.deleteTag(404L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();

            verifyNoInteractions(articleTagRepository);
        }
    }

    @Test
    @DisplayName("getTagBySlug should fail with NotFound for an unknown slug")
    void shouldFailForUnknownSlug() {
        when(tagRepository.findBySlug("nope")).thenReturn(Mono.empty());

        StepVerifier.create(tagService.getTagBySlug("nope"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
