package com.flare.mentionsprocessor.exception;

/**
 * Raised by the classification client when the provider call fails.
 * Carries the HTTP status when the provider answered with a non-success code.
 */
public class ClassificationProviderException extends RuntimeException {

    private final Integer httpStatus;

    public ClassificationProviderException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ClassificationProviderException(String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public boolean hasHttpStatus() {
        return httpStatus != null;
    }

}
