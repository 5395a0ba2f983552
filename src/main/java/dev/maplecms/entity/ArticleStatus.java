package dev.maplecms.entity;

public enum ArticleStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED;

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    /**
     * Parse a client-supplied status, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    public static ArticleStatus parse(String status) {
        if (status == null) {
            throw new IllegalArgumentException("error.invalid_status");
        }
        try {
            return ArticleStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("error.invalid_status", e);
        }
    }
}
