package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * An admin action asked for a transition the entry state machine does not allow,
 * e.g. cancelling an entry as Pending after the webhook already completed it.
 */
public class PaymentStateMismatchException extends EntryServiceException {

    public PaymentStateMismatchException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "PAYMENT_STATE_MISMATCH";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.CONFLICT;
    }
}
