package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Login or reset attempts from this email/IP exceeded the 60-second threshold.
 */
public class TooManyAttemptsException extends EntryServiceException {

    public TooManyAttemptsException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "TOO_MANY_ATTEMPTS";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.TOO_MANY_REQUESTS;
    }
}
