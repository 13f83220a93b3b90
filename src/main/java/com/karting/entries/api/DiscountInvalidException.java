package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * Discount code is unknown, inactive, or does not apply to the requested flow.
 */
public class DiscountInvalidException extends EntryServiceException {

    public DiscountInvalidException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "DISCOUNT_INVALID";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_REQUEST;
    }
}
