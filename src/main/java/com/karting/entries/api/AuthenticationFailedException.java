package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Missing or wrong driver credentials or admin token.
 */
public class AuthenticationFailedException extends EntryServiceException {

    public AuthenticationFailedException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "AUTHENTICATION_FAILED";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.UNAUTHORIZED;
    }
}
