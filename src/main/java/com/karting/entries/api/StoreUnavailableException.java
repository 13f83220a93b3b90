package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Database communication failed after the single retry.
 */
public class StoreUnavailableException extends EntryServiceException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "STORE_UNAVAILABLE";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.SERVICE_UNAVAILABLE;
    }
}
