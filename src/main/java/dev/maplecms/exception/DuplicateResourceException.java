package dev.maplecms.exception;

import lombok.Getter;

/**
 * A unique constraint (slug, name, username or email) would be violated.
 */
@Getter
public class DuplicateResourceException extends RuntimeException {

    private final String resourceName;
    private final String fieldName;
    private final transient Object fieldValue;

    public DuplicateResourceException(String resourceName, String fieldName, Object fieldValue) {
        super(String.format("%s already exists with %s: '%s'", resourceName, fieldName, fieldValue));
        this.resourceName = resourceName;
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
    }

    public DuplicateResourceException(String resourceName, String fieldName, Object fieldValue, Throwable cause) {
        this(resourceName, fieldName, fieldValue);
        initCause(cause);
    }

    /**
     * @param messageKey i18n key resolved by {@link GlobalExceptionHandler}
     */
    public DuplicateResourceException(String messageKey, Throwable cause) {
        super(messageKey, cause);
        this.resourceName = null;
        this.fieldName = null;
        this.fieldValue = null;
    }
}
