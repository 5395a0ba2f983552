package dev.maplecms.service;

import dev.maplecms.dto.PageResponse;
import dev.maplecms.dto.TagRequest;
import dev.maplecms.dto.TagResponse;
import dev.maplecms.entity.Tag;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.exception.ResourceNotFoundException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleTagRepository;
import dev.maplecms.repository.TagRepository;
import dev.maplecms.service.slug.EntityType;
import dev.maplecms.service.slug.SlugResolver;
import dev.maplecms.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class TagService {

    private final TagRepository tagRepository;
    private final ArticleTagRepository articleTagRepository;
    private final SlugResolver slugResolver;
    private final TransactionalOperator transactionalOperator;
    private final IdService idService;
    private final ContentMetrics metrics;

    public Mono<TagResponse> getTagById(Long id) {
        return tagRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                .map(TagResponse::fromEntity);
    }

    public Mono<TagResponse> getTagBySlug(String slug) {
        return tagRepository.findBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "slug", slug)))
                .map(TagResponse::fromEntity);
    }

    public Mono<PageResponse<TagResponse>> listTags(long skip, int limit) {
        return Mono.zip(
                tagRepository.findAllPaged(limit, skip).map(TagResponse::fromEntity).collectList(),
                tagRepository.countAll()
        ).map(tuple -> PageResponse.of(tuple.getT1(), skip, limit, tuple.getT2()));
    }

    public Mono<TagResponse> createTag(TagRequest request) {
        String name = request.getName().trim();
        Mono<Tag> unit = transactionalOperator.transactional(Mono.defer(() ->
                ensureNameAvailable(name, null)
                        .then(Mono.defer(() -> slugResolver.resolveSlug(EntityType.TAG, name, null)))
                        .flatMap(slug -> {
                            LocalDateTime now = Timestamps.now();
                            return tagRepository.save(Tag.builder()
                                    .id(idService.nextId())
                                    .name(name)
                                    .slug(slug)
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .build());
                        })));

        return slugResolver.retryOnSlugConflict(EntityType.TAG, unit)
                .doOnSuccess(tag -> {
                    metrics.entityCreated("tag");
                    log.info("Tag created: {}", tag.getSlug());
                })
                .map(TagResponse::fromEntity);
    }

    /**
     * Rename a tag. The slug changes only when the new name normalizes to a different base.
     */
    public Mono<TagResponse> updateTag(Long id, TagRequest request) {
        String name = request.getName().trim();
        Mono<Tag> unit = transactionalOperator.transactional(Mono.defer(() ->
                tagRepository.findById(id)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                        .flatMap(tag -> ensureNameAvailable(name, id)
                                .then(Mono.defer(() -> slugResolver.requiresNewSlug(EntityType.TAG, name, tag.getName(), tag.getSlug())
                                        ? slugResolver.resolveSlug(EntityType.TAG, name, id)
                                        : Mono.just(tag.getSlug())))
                                .flatMap(slug -> {
                                    tag.setName(name);
                                    tag.setSlug(slug);
                                    tag.setUpdatedAt(Timestamps.now());
                                    return tagRepository.save(tag);
                                }))));

        return slugResolver.retryOnSlugConflict(EntityType.TAG, unit)
                .doOnSuccess(tag -> log.info("Tag updated: {} (slug={})", id, tag.getSlug()))
                .map(TagResponse::fromEntity);
    }

    /**
     * Delete a tag and its article associations. The articles themselves are untouched.
     */
    @Transactional
    public Mono<Void> deleteTag(Long id) {
        return tagRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tag", "id", id)))
                .flatMap(tag -> articleTagRepository.deleteByTagId(id)
                        .flatMap(detached -> tagRepository.deleteById(id)
                                .doOnSuccess(v -> {
                                    metrics.entityDeleted("tag");
                                    log.info("Tag deleted: {} (slug={}, detached from {} articles)", id, tag.getSlug(), detached);
                                })));
    }

    private Mono<Void> ensureNameAvailable(String name, Long excludeId) {
        return tagRepository.findIdByName(name)
                .filter(ownerId -> !ownerId.equals(excludeId))
                .flatMap(ownerId -> Mono.<Void>error(new DuplicateResourceException("Tag", "name", name)))
                .then();
    }
}
