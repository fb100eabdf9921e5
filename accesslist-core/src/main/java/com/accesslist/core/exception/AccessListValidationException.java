package com.accesslist.core.exception;

/**
 * Thrown when a mutation violates a domain rule of an access list.
 */
public class AccessListValidationException extends RegistryException {

    public static final String ERROR_CODE = "ACCESS_LIST_VALIDATION_FAILED";

    private final String parameter;

    public AccessListValidationException(String parameter, String message) {
        super(ERROR_CODE, message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
