package dev.maplecms.repository;

import dev.maplecms.entity.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long>, ArticleSearchRepository {

    Mono<Article> findBySlug(String slug);

    @Query("SELECT id FROM articles WHERE slug = :slug")
    Mono<Long> findIdBySlug(String slug);

    @Query("SELECT COUNT(*) FROM articles WHERE author_id = :authorId")
    Mono<Long> countByAuthorId(Long authorId);

    /**
     * Detach every article from a category that is about to be deleted.
     */
    @Modifying
    @Query("UPDATE articles SET category_id = NULL WHERE category_id = :categoryId")
    Mono<Long> clearCategory(Long categoryId);
}
