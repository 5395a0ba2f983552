package dev.maplecms.repository;

import dev.maplecms.entity.Category;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CategoryRepository extends ReactiveCrudRepository<Category, Long> {

    Mono<Category> findBySlug(String slug);

    /**
     * Id of the category currently holding {@code slug}, if any.
     */
    @Query("SELECT id FROM categories WHERE slug = :slug")
    Mono<Long> findIdBySlug(String slug);

    @Query("SELECT id FROM categories WHERE LOWER(name) = LOWER(:name)")
    Mono<Long> findIdByName(String name);

    @Query("SELECT * FROM categories ORDER BY name ASC LIMIT :limit OFFSET :offset")
    Flux<Category> findAllPaged(int limit, long offset);

    @Query("SELECT COUNT(*) FROM categories")
    Mono<Long> countAll();
}
