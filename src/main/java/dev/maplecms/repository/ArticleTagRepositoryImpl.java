package dev.maplecms.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
@RequiredArgsConstructor
public class ArticleTagRepositoryImpl implements ArticleTagRepository {

    private static final String INSERT =
            "INSERT INTO article_tags (article_id, tag_id) VALUES (:articleId, :tagId)";

    private static final String DELETE_BY_ARTICLE =
            "DELETE FROM article_tags WHERE article_id = :articleId";

    private static final String DELETE_BY_TAG =
            "DELETE FROM article_tags WHERE tag_id = :tagId";

    private final R2dbcEntityTemplate r2dbcTemplate;

    @Override
    public Mono<Void> insertArticleTag(Long articleId, Long tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(INSERT)
                .bind("articleId", articleId)
                .bind("tagId", tagId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Long> deleteByArticleId(Long articleId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_ARTICLE)
                .bind("articleId", articleId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Long> deleteByTagId(Long tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_TAG)
                .bind("tagId", tagId)
                .fetch()
                .rowsUpdated();
    }
}
