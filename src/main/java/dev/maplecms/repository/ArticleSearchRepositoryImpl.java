package dev.maplecms.repository;

import dev.maplecms.dto.ArticleFilter;
import dev.maplecms.entity.Article;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Data picks this up as the fragment implementation of {@link ArticleSearchRepository}
 * for {@link ArticleRepository}.
 */
@RequiredArgsConstructor
public class ArticleSearchRepositoryImpl implements ArticleSearchRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    @Override
    public Flux<Article> findByFilter(ArticleFilter filter, long skip, int limit) {
        Query query = Query.query(toCriteria(filter))
                .sort(Sort.by(Sort.Direction.DESC, "createdAt"))
                .offset(skip)
                .limit(limit);
        return r2dbcTemplate.select(query, Article.class);
    }

    @Override
    public Mono<Long> countByFilter(ArticleFilter filter) {
        return r2dbcTemplate.count(Query.query(toCriteria(filter)), Article.class);
    }

    static Criteria toCriteria(ArticleFilter filter) {
        List<Criteria> conditions = new ArrayList<>();
        if (filter != null) {
            if (filter.getStatus() != null) {
                conditions.add(Criteria.where("status").is(filter.getStatus().name()));
            }
            if (filter.getAuthorId() != null) {
                conditions.add(Criteria.where("authorId").is(filter.getAuthorId()));
            }
            if (filter.getCategoryId() != null) {
                conditions.add(Criteria.where("categoryId").is(filter.getCategoryId()));
            }
        }
        return Criteria.from(conditions);
    }
}
