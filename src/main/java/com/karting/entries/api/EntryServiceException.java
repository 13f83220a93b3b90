package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Base of every error the race-entry core raises. Each subclass fixes a stable
 * error code and HTTP status; {@link GlobalExceptionHandler} renders them.
 */
public abstract class EntryServiceException extends RuntimeException {

    protected EntryServiceException(String message) {
        super(message);
    }

    protected EntryServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getErrorCode();

    public abstract HttpStatus getStatus();

    /** Whether the message is safe to show to a driver as-is. */
    public boolean isClientFacing() {
        return getStatus().is4xxClientError();
    }
}
