package dev.maplecms.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 160, message = "Title must be at most 160 characters")
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
