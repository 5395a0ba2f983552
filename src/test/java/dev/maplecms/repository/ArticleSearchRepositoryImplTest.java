package dev.maplecms.repository;

import dev.maplecms.dto.ArticleFilter;
import dev.maplecms.entity.ArticleStatus;
import org.junit.jupiter.api.Test;
import org.springframework.data.relational.core.query.Criteria;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleSearchRepositoryImplTest {

    @Test
    void shouldMatchEverythingWithoutFilter() {
        assertThat(ArticleSearchRepositoryImpl.toCriteria(null).isEmpty()).isTrue();
        assertThat(ArticleSearchRepositoryImpl.toCriteria(new ArticleFilter()).isEmpty()).isTrue();
    }

    @Test
    void shouldCombineGivenFilters() {
        ArticleFilter filter = ArticleFilter.builder()
                .status(ArticleStatus.PUBLISHED)
                .categoryId(9L)
                .build();

        Criteria criteria = ArticleSearchRepositoryImpl.toCriteria(filter);

        assertThat(criteria.isEmpty()).isFalse();
        assertThat(criteria.toString())
                .contains("status")
                .contains("categoryId")
                .doesNotContain("authorId");
    }
}
