package dev.maplecms.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Table("articles")
@Getter
@Setter
@ToString(exclude = {"contentMd", "contentHtml", "tags"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String title;
    private String slug;
    private String excerpt;

    @Column("content_md")
    private String contentMd;

    @Column("content_html")
    private String contentHtml;

    @Builder.Default
    private String status = ArticleStatus.DRAFT.name();

    @Column("author_id")
    private Long authorId;

    @Column("category_id")
    private Long categoryId;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("meta_json")
    @Builder.Default
    private Metadata metaJson = Metadata.empty();

    @Transient
    @Builder.Default
    private List<Tag> tags = new ArrayList<>();

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isPublished() {
        return ArticleStatus.PUBLISHED.matches(status);
    }

    /**
     * Move to {@code newStatus}. {@code publishedAt} is stamped on the first
     * transition into PUBLISHED and kept on every later one.
     */
    public void transitionTo(ArticleStatus newStatus, LocalDateTime now) {
        this.status = newStatus.name();
        if (newStatus == ArticleStatus.PUBLISHED && this.publishedAt == null) {
            this.publishedAt = now;
        }
    }
}
