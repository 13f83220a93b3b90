package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Referenced driver, event, entry or rental does not exist.
 */
public class NotFoundException extends EntryServiceException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
