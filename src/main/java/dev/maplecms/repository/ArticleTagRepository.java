package dev.maplecms.repository;

import reactor.core.publisher.Mono;

/**
 * Rows of the {@code article_tags} join table. R2DBC has no join-entity support,
 * so these go through {@code DatabaseClient}.
 */
public interface ArticleTagRepository {

    Mono<Void> insertArticleTag(Long articleId, Long tagId);

    Mono<Long> deleteByArticleId(Long articleId);

    Mono<Long> deleteByTagId(Long tagId);
}
