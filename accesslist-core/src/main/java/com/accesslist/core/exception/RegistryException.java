package com.accesslist.core.exception;

/**
 * Base exception for all access list registry errors.
 */
public class RegistryException extends RuntimeException {

    private final String errorCode;

    public RegistryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RegistryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
