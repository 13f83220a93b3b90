package com.karting.entries.core;

import lombok.Value;

/**
 * What the webhook endpoint reports back. The gateway only looks at the HTTP status.
 */
@Value
public class NotificationReceipt {

    String paymentReference;
    /** Null when processing failed and the payload went to the failed-notification log. */
    ReconcileOutcome.Result result;
    boolean loggedForReview;

    static NotificationReceipt processed(ReconcileOutcome outcome) {
        return new NotificationReceipt(outcome.getPaymentReference(), outcome.getResult(),
                outcome.getResult() == ReconcileOutcome.Result.UNKNOWN_REFERENCE);
    }

    static NotificationReceipt loggedForReview(String paymentReference) {
        return new NotificationReceipt(paymentReference, null, true);
    }
}
