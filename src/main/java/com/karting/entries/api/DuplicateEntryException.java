package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * A new insert would violate UNIQUE (driver_id, event_id, payment_reference), or a
 * season rental for the same key is already paid. Callers that can prove the existing
 * row matches treat this as idempotent success instead of surfacing it.
 */
public class DuplicateEntryException extends EntryServiceException {

    private final String paymentReference;

    public DuplicateEntryException(String paymentReference, String message) {
        super(message);
        this.paymentReference = paymentReference;
    }

    public String getPaymentReference() {
        return paymentReference;
    }

    @Override
    public String getErrorCode() {
        return "DUPLICATE_ENTRY";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
