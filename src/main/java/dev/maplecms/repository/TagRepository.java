package dev.maplecms.repository;

import dev.maplecms.entity.Tag;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface TagRepository extends ReactiveCrudRepository<Tag, Long> {

    Mono<Tag> findBySlug(String slug);

    @Query("SELECT id FROM tags WHERE slug = :slug")
    Mono<Long> findIdBySlug(String slug);

    @Query("SELECT id FROM tags WHERE LOWER(name) = LOWER(:name)")
    Mono<Long> findIdByName(String name);

    @Query("SELECT * FROM tags WHERE id IN (:ids)")
    Flux<Tag> findByIdIn(Collection<Long> ids);

    @Query("SELECT t.* FROM tags t " +
           "JOIN article_tags at ON t.id = at.tag_id " +
           "WHERE at.article_id = :articleId " +
           "ORDER BY t.name ASC")
    Flux<Tag> findByArticleId(Long articleId);

    @Query("SELECT * FROM tags ORDER BY name ASC LIMIT :limit OFFSET :offset")
    Flux<Tag> findAllPaged(int limit, long offset);

    @Query("SELECT COUNT(*) FROM tags")
    Mono<Long> countAll();
}
