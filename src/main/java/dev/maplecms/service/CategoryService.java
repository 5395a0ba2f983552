package dev.maplecms.service;

import dev.maplecms.dto.CategoryRequest;
import dev.maplecms.dto.CategoryResponse;
import dev.maplecms.dto.PageResponse;
import dev.maplecms.entity.Category;
import dev.maplecms.exception.DuplicateResourceException;
import dev.maplecms.exception.ResourceNotFoundException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleRepository;
import dev.maplecms.repository.CategoryRepository;
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
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final ArticleRepository articleRepository;
    private final SlugResolver slugResolver;
    private final TransactionalOperator transactionalOperator;
    private final IdService idService;
    private final ContentMetrics metrics;

    public Mono<CategoryResponse> getCategoryById(Long id) {
        return categoryRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                .map(CategoryResponse::fromEntity);
    }

    public Mono<CategoryResponse> getCategoryBySlug(String slug) {
        return categoryRepository.findBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "slug", slug)))
                .map(CategoryResponse::fromEntity);
    }

    public Mono<PageResponse<CategoryResponse>> listCategories(long skip, int limit) {
        return Mono.zip(
                categoryRepository.findAllPaged(limit, skip).map(CategoryResponse::fromEntity).collectList(),
                categoryRepository.countAll()
        ).map(tuple -> PageResponse.of(tuple.getT1(), skip, limit, tuple.getT2()));
    }

    public Mono<CategoryResponse> createCategory(CategoryRequest request) {
        if (request.getName() == null) {
            return Mono.error(new IllegalArgumentException("error.name_required"));
        }
        String name = request.getName().trim();
        Mono<Category> unit = transactionalOperator.transactional(Mono.defer(() ->
                ensureNameAvailable(name, null)
                        .then(Mono.defer(() -> slugResolver.resolveSlug(EntityType.CATEGORY, name, null)))
                        .flatMap(slug -> {
                            LocalDateTime now = Timestamps.now();
                            return categoryRepository.save(Category.builder()
                                    .id(idService.nextId())
                                    .name(name)
                                    .slug(slug)
                                    .description(request.getDescription())
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .build());
                        })));

        return slugResolver.retryOnSlugConflict(EntityType.CATEGORY, unit)
                .doOnSuccess(category -> {
                    metrics.entityCreated("category");
                    log.info("Category created: {}", category.getSlug());
                })
                .map(CategoryResponse::fromEntity);
    }

    public Mono<CategoryResponse> updateCategory(Long id, CategoryRequest request) {
        String name = request.getName() != null ? request.getName().trim() : null;
        Mono<Category> unit = transactionalOperator.transactional(Mono.defer(() ->
                categoryRepository.findById(id)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                        .flatMap(category -> {
                            if (name == null) {
                                return Mono.just(category);
                            }
                            return ensureNameAvailable(name, id)
                                    .then(Mono.defer(() -> slugResolver.requiresNewSlug(EntityType.CATEGORY, name, category.getName(), category.getSlug())
                                            ? slugResolver.resolveSlug(EntityType.CATEGORY, name, id)
                                            : Mono.just(category.getSlug())))
                                    .map(slug -> {
                                        category.setName(name);
                                        category.setSlug(slug);
                                        return category;
                                    });
                        })
                        .flatMap(category -> {
                            if (request.getDescription() != null) {
                                category.setDescription(request.getDescription());
                            }
                            category.setUpdatedAt(Timestamps.now());
                            return categoryRepository.save(category);
                        })));

        return slugResolver.retryOnSlugConflict(EntityType.CATEGORY, unit)
                .doOnSuccess(category -> log.info("Category updated: {} (slug={})", id, category.getSlug()))
                .map(CategoryResponse::fromEntity);
    }

    /**
     * Delete a category. Articles filed under it are kept with no category.
     */
    @Transactional
    public Mono<Void> deleteCategory(Long id) {
        return categoryRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Category", "id", id)))
                .flatMap(category -> articleRepository.clearCategory(id)
                        .flatMap(detached -> categoryRepository.deleteById(id)
                                .doOnSuccess(v -> {
                                    metrics.entityDeleted("category");
                                    log.info("Category deleted: {} (slug={}, {} articles uncategorized)", id, category.getSlug(), detached);
                                })));
    }

    private Mono<Void> ensureNameAvailable(String name, Long excludeId) {
        return categoryRepository.findIdByName(name)
                .filter(ownerId -> !ownerId.equals(excludeId))
                .flatMap(ownerId -> Mono.<Void>error(new DuplicateResourceException("Category", "name", name)))
                .then();
    }
}
