package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Webhook signature (or merchant id) did not verify. Nothing was written.
 */
public class SignatureInvalidException extends EntryServiceException {

    public SignatureInvalidException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "SIGNATURE_INVALID";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
