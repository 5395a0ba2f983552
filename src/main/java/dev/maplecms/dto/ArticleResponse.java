package dev.maplecms.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.maplecms.entity.Article;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleResponse {
    private String id;
    private String title;
    private String slug;
    private String excerpt;
    private String contentMd;
    private String contentHtml;
    private String status;
    private String authorId;
    private String categoryId;
    private List<TagResponse> tags;
    private Map<String, Object> meta;
    private LocalDateTime publishedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ArticleResponse fromEntity(Article article) {
        return ArticleResponse.builder()
                .id(String.valueOf(article.getId()))
                .title(article.getTitle())
                .slug(article.getSlug())
                .excerpt(article.getExcerpt())
                .contentMd(article.getContentMd())
                .contentHtml(article.getContentHtml())
                .status(article.getStatus())
                .authorId(article.getAuthorId() != null ? String.valueOf(article.getAuthorId()) : null)
                .categoryId(article.getCategoryId() != null ? String.valueOf(article.getCategoryId()) : null)
                .tags(article.getTags() != null
                        ? article.getTags().stream().map(TagResponse::fromEntity).toList()
                        : List.of())
                .meta(article.getMetaJson() != null ? article.getMetaJson().asMap() : Map.of())
                .publishedAt(article.getPublishedAt())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }
}
