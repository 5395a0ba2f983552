package dev.maplecms.exception;

import lombok.Getter;

/**
 * A referenced entity does not exist.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceName;
    private final String fieldName;
    private final transient Object fieldValue;

    public ResourceNotFoundException(String resourceName, String fieldName, Object fieldValue) {
        super(String.format("%s not found with %s: '%s'", resourceName, fieldName, fieldValue));
        this.resourceName = resourceName;
        this.fieldName = fieldName;
        this.fieldValue = fieldValue;
    }

    /**
     * @param messageKey i18n key resolved by {@link GlobalExceptionHandler}
     */
    public ResourceNotFoundException(String messageKey) {
        super(messageKey);
        this.resourceName = null;
        this.fieldName = null;
        this.fieldValue = null;
    }
}
