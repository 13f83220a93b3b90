package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Event is not accepting driver-initiated entries (flag off or deadline passed).
 */
public class RegistrationClosedException extends EntryServiceException {

    public RegistrationClosedException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "REGISTRATION_CLOSED";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
