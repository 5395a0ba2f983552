package dev.maplecms.dto;

import dev.maplecms.entity.ArticleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional equality filters for article listing; {@code null} means "any".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleFilter {
    private ArticleStatus status;
    private Long authorId;
    private Long categoryId;
}
