package dev.maplecms.repository;

import dev.maplecms.dto.ArticleFilter;
import dev.maplecms.entity.Article;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Filtered article listing. Every non-null field of the filter is an equality
 * condition; conditions are combined with AND.
 */
public interface ArticleSearchRepository {

    Flux<Article> findByFilter(ArticleFilter filter, long skip, int limit);

    Mono<Long> countByFilter(ArticleFilter filter);
}
