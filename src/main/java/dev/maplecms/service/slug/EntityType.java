package dev.maplecms.service.slug;

/**
 * Slug namespaces. Each carries the length of its {@code slug} column and the name of
 * the unique constraint guarding it.
 */
public enum EntityType {

    ARTICLE("Article", 180, "uq_articles_slug"),
    CATEGORY("Category", 80, "uq_categories_slug"),
    TAG("Tag", 64, "uq_tags_slug");

    private final String displayName;
    private final int maxSlugLength;
    private final String slugConstraint;

    EntityType(String displayName, int maxSlugLength, String slugConstraint) {
        this.displayName = displayName;
        this.maxSlugLength = maxSlugLength;
        this.slugConstraint = slugConstraint;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getMaxSlugLength() {
        return maxSlugLength;
    }

    public String getSlugConstraint() {
        return slugConstraint;
    }
}
