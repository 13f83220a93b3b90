package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Malformed request. Carries the offending field so drivers see exactly what to fix.
 */
public class ValidationFailedException extends EntryServiceException {

    private final String field;

    public ValidationFailedException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public String getErrorCode() {
        return "VALIDATION_FAILED";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
