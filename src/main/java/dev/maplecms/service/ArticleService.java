package dev.maplecms.service;

import dev.maplecms.dto.ArticleFilter;
import dev.maplecms.dto.ArticleRequest;
import dev.maplecms.dto.ArticleResponse;
import dev.maplecms.dto.ArticleUpdateRequest;
import dev.maplecms.dto.PageResponse;
import dev.maplecms.entity.Article;
import dev.maplecms.entity.ArticleStatus;
import dev.maplecms.entity.Metadata;
import dev.maplecms.entity.UserRole;
import dev.maplecms.exception.ResourceNotFoundException;
import dev.maplecms.metrics.ContentMetrics;
import dev.maplecms.repository.ArticleRepository;
import dev.maplecms.repository.ArticleTagRepository;
import dev.maplecms.repository.CategoryRepository;
import dev.maplecms.repository.TagRepository;
import dev.maplecms.repository.UserRepository;
import dev.maplecms.service.slug.EntityType;
import dev.maplecms.service.slug.SlugResolver;
import dev.maplecms.util.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    private final ArticleRepository articleRepository;
    private final ArticleTagRepository articleTagRepository;
    private final CategoryRepository categoryRepository;
    private final TagRepository tagRepository;
    private final UserRepository userRepository;
    private final UserService userService;
    private final SlugResolver slugResolver;
    private final TransactionalOperator transactionalOperator;
    private final MarkdownService markdownService;
    private final HtmlSanitizerService htmlSanitizerService;
    private final IdService idService;
    private final ContentMetrics metrics;

    public Mono<ArticleResponse> getArticle(Long id) {
        log.debug("Fetching article id={}", id);
        return articleRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "id", id)))
                .flatMap(this::withTags)
                .map(ArticleResponse::fromEntity);
    }

    public Mono<ArticleResponse> getArticleBySlug(String slug) {
        log.debug("Fetching article slug={}", slug);
        return articleRepository.findBySlug(slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "slug", slug)))
                .flatMap(this::withTags)
                .map(ArticleResponse::fromEntity);
    }

    public Mono<PageResponse<ArticleResponse>> listArticles(ArticleFilter filter, long skip, int limit) {
        return Mono.zip(
                articleRepository.findByFilter(filter, skip, limit)
                        .concatMap(this::withTags)
                        .map(ArticleResponse::fromEntity)
                        .collectList(),
                articleRepository.countByFilter(filter)
        ).map(tuple -> PageResponse.of(tuple.getT1(), skip, limit, tuple.getT2()));
    }

    /**
     * Create an article authored by {@code authorId}. Author, category and tags must exist;
     * the whole insert is retried when a concurrent writer takes the slug first.
     */
    public Mono<ArticleResponse> createArticle(ArticleRequest request, Long authorId) {
        return Mono.defer(() -> insertArticle(request, authorId));
    }

    private Mono<ArticleResponse> insertArticle(ArticleRequest request, Long authorId) {
        List<Long> tagIds = distinct(request.getTagIds());
        ArticleStatus status = request.getStatus() != null && !request.getStatus().isBlank()
                ? ArticleStatus.parse(request.getStatus())
                : ArticleStatus.DRAFT;
        String title = request.getTitle().trim();

        Mono<Article> unit = transactionalOperator.transactional(Mono.defer(() ->
                ensureAuthorExists(authorId)
                        .then(ensureCategoryExists(request.getCategoryId()))
                        .then(ensureTagsExist(tagIds))
                        .then(Mono.defer(() -> slugResolver.resolveSlug(EntityType.ARTICLE, title, null)))
                        .flatMap(slug -> {
                            LocalDateTime now = Timestamps.now();
                            Article article = Article.builder()
                                    .id(idService.nextId())
                                    .title(title)
                                    .slug(slug)
                                    .excerpt(cleanExcerpt(request.getExcerpt()))
                                    .contentMd(request.getContentMd())
                                    .contentHtml(renderContent(request.getContentMd(), request.getContentHtml()))
                                    .authorId(authorId)
                                    .categoryId(request.getCategoryId())
                                    .metaJson(request.getMeta() != null ? new Metadata(request.getMeta()) : Metadata.empty())
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .build();
                            article.transitionTo(status, now);
                            return articleRepository.save(article);
                        })
                        .flatMap(saved -> insertTags(saved.getId(), tagIds).thenReturn(saved))
                        .flatMap(this::withTags)));

        return slugResolver.retryOnSlugConflict(EntityType.ARTICLE, unit)
                .doOnSuccess(article -> {
                    metrics.entityCreated("article");
                    log.info("Article created: {}", article.getSlug());
                })
                .map(ArticleResponse::fromEntity);
    }

    /**
     * Partial update. Null fields are left untouched and a non-null {@code tagIds} replaces
     * the article's tags.
     */
    public Mono<ArticleResponse> updateArticle(Long id, ArticleUpdateRequest request) {
        return Mono.defer(() -> modifyArticle(id, request));
    }

    private Mono<ArticleResponse> modifyArticle(Long id, ArticleUpdateRequest request) {
        List<Long> tagIds = request.getTagIds() != null ? distinct(request.getTagIds()) : null;
        ArticleStatus status = request.getStatus() != null && !request.getStatus().isBlank()
                ? ArticleStatus.parse(request.getStatus())
                : null;

        Mono<Article> unit = transactionalOperator.transactional(Mono.defer(() ->
                articleRepository.findById(id)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "id", id)))
                        .flatMap(article -> ensureCategoryExists(request.getCategoryId())
                                .then(ensureTagsExist(tagIds))
                                .then(Mono.defer(() -> resolveUpdatedSlug(article, request.getTitle())))
                                .flatMap(slug -> {
                                    LocalDateTime now = Timestamps.now();
                                    applyUpdate(article, request, status, now);
                                    article.setSlug(slug);
                                    article.setUpdatedAt(now);
                                    return articleRepository.save(article);
                                }))
                        .flatMap(saved -> replaceTags(saved.getId(), tagIds).thenReturn(saved))
                        .flatMap(this::withTags)));

        return slugResolver.retryOnSlugConflict(EntityType.ARTICLE, unit)
                .doOnSuccess(article -> log.info("Article updated: {} ({})", article.getId(), article.getSlug()))
                .map(ArticleResponse::fromEntity);
    }

    @Transactional
    public Mono<Void> deleteArticle(Long id) {
        return articleRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "id", id)))
                .flatMap(article -> articleTagRepository.deleteByArticleId(id)
                        .then(articleRepository.deleteById(id))
                        .doOnSuccess(v -> {
                            metrics.entityDeleted("article");
                            log.info("Article deleted: {} ({})", id, article.getSlug());
                        }));
    }

    /**
     * Completes empty when {@code actorEmail} may modify the article: its author, or any
     * EDITOR or above.
     */
    public Mono<Void> verifyCanModify(Long articleId, String actorEmail) {
        return articleRepository.findById(articleId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "id", articleId)))
                .zipWith(userService.findByEmail(actorEmail))
                .flatMap(tuple -> {
                    Article article = tuple.getT1();
                    var actor = tuple.getT2();
                    if (UserRole.EDITOR.isSatisfiedBy(actor.getRole()) || actor.getId().equals(article.getAuthorId())) {
                        return Mono.<Void>empty();
                    }
                    log.warn("User {} denied modification of article {}", actor.getId(), articleId);
                    return Mono.error(new AccessDeniedException("error.forbidden"));
                });
    }

    private Mono<String> resolveUpdatedSlug(Article article, String newTitle) {
        if (newTitle == null) {
            return Mono.just(article.getSlug());
        }
        String title = newTitle.trim();
        if (!slugResolver.requiresNewSlug(EntityType.ARTICLE, title, article.getTitle(), article.getSlug())) {
            return Mono.just(article.getSlug());
        }
        return slugResolver.resolveSlug(EntityType.ARTICLE, title, article.getId());
    }

    private void applyUpdate(Article article, ArticleUpdateRequest request, ArticleStatus status, LocalDateTime now) {
        if (request.getTitle() != null) {
            article.setTitle(request.getTitle().trim());
        }
        if (request.getExcerpt() != null) {
            article.setExcerpt(cleanExcerpt(request.getExcerpt()));
        }
        if (request.getContentHtml() != null) {
            article.setContentHtml(htmlSanitizerService.sanitize(request.getContentHtml()));
            if (request.getContentMd() != null) {
                article.setContentMd(request.getContentMd());
            }
        } else if (request.getContentMd() != null) {
            article.setContentMd(request.getContentMd());
            article.setContentHtml(renderContent(request.getContentMd(), null));
        }
        if (request.getCategoryId() != null) {
            article.setCategoryId(request.getCategoryId());
        }
        if (request.getMeta() != null) {
            article.setMetaJson(new Metadata(request.getMeta()));
        }
        if (status != null) {
            article.transitionTo(status, now);
        }
    }

    private String renderContent(String markdown, String html) {
        if (html != null) {
            return htmlSanitizerService.sanitize(html);
        }
        if (markdown != null) {
            return htmlSanitizerService.sanitize(markdownService.renderToHtml(markdown));
        }
        return null;
    }

    private String cleanExcerpt(String excerpt) {
        return excerpt != null ? htmlSanitizerService.stripHtml(excerpt) : null;
    }

    private Mono<Void> ensureAuthorExists(Long authorId) {
        return userRepository.existsById(authorId)
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new ResourceNotFoundException("User", "id", authorId)));
    }

    private Mono<Void> ensureCategoryExists(Long categoryId) {
        if (categoryId == null) {
            return Mono.empty();
        }
        return categoryRepository.existsById(categoryId)
                .flatMap(exists -> exists
                        ? Mono.<Void>empty()
                        : Mono.error(new ResourceNotFoundException("Category", "id", categoryId)));
    }

    private Mono<Void> ensureTagsExist(List<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            return Mono.empty();
        }
        return tagRepository.findByIdIn(tagIds)
                .map(tag -> tag.getId())
                .collect(HashSet<Long>::new, Set::add)
                .flatMap(found -> {
                    for (Long tagId : tagIds) {
                        if (!found.contains(tagId)) {
                            return Mono.error(new ResourceNotFoundException("Tag", "id", tagId));
                        }
                    }
                    return Mono.<Void>empty();
                });
    }

    private Mono<Void> replaceTags(Long articleId, List<Long> tagIds) {
        if (tagIds == null) {
            return Mono.empty();
        }
        return articleTagRepository.deleteByArticleId(articleId)
                .then(insertTags(articleId, tagIds));
    }

    private Mono<Void> insertTags(Long articleId, List<Long> tagIds) {
        if (tagIds.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(tagIds)
                .concatMap(tagId -> articleTagRepository.insertArticleTag(articleId, tagId))
                .then();
    }

    private Mono<Article> withTags(Article article) {
        return tagRepository.findByArticleId(article.getId())
                .collectList()
                .map(tags -> {
                    article.setTags(tags);
                    return article;
                });
    }

    private static List<Long> distinct(List<Long> ids) {
        if (ids == null) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(ids));
    }
}
