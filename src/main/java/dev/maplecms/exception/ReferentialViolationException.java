package dev.maplecms.exception;

import lombok.Getter;

/**
 * Deleting an entity is refused because other rows still reference it under a RESTRICT rule.
 */
@Getter
public class ReferentialViolationException extends RuntimeException {

    private final String resourceName;
    private final transient Object resourceId;
    private final String referencedBy;

    public ReferentialViolationException(String resourceName, Object resourceId, String referencedBy) {
        super(String.format("%s '%s' is still referenced by %s", resourceName, resourceId, referencedBy));
        this.resourceName = resourceName;
        this.resourceId = resourceId;
        this.referencedBy = referencedBy;
    }
}
