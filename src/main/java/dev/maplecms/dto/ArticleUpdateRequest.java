package dev.maplecms.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial article update. A {@code null} field is left unchanged; an empty
 * {@code tagIds} list removes every tag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleUpdateRequest {

    @Size(min = 1, max = 160, message = "Title must be between 1 and 160 characters")
    @Pattern(regexp = ".*\\S.*", message = "Title must not be blank")
    private String title;

    @Size(max = 1000, message = "Excerpt must be at most 1000 characters")
    private String excerpt;

    @Size(max = 500000, message = "Markdown content must be at most 500000 characters")
    private String contentMd;

    @Size(max = 1000000, message = "HTML content must be at most 1000000 characters")
    private String contentHtml;

    @Pattern(regexp = "^(DRAFT|PUBLISHED|ARCHIVED)?$", message = "Status must be DRAFT, PUBLISHED or ARCHIVED")
    private String status;

    private Long categoryId;

    @Size(max = 50, message = "Maximum 50 tags allowed")
    private List<Long> tagIds;

    private Map<String, Object> meta;
}
