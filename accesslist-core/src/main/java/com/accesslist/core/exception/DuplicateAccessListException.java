package com.accesslist.core.exception;

/**
 * Thrown when creating an access list whose owner and identifier are already taken.
 */
public class DuplicateAccessListException extends RegistryException {

    public static final String ERROR_CODE = "DUPLICATE_ACCESS_LIST";

    public DuplicateAccessListException(String resourceOwner, String identifier, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Access list already exists: %s/%s",
            resourceOwner, identifier
        ), cause);
    }

    public DuplicateAccessListException(String resourceOwner, String identifier) {
        this(resourceOwner, identifier, null);
    }
}
