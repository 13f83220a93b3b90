package com.karting.entries.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A webhook payload after its signature has been verified. Only the gateway adapter builds these.
 */
@Value
@Builder(toBuilder = true)
public class WebhookNotification {

    PaymentReference paymentReference;
    String pfPaymentId;
    BigDecimal amountGross;
    GatewayPaymentStatus paymentStatus;
    String rawPaymentStatus;
    String payerEmail;
    String payerFirstName;
    String payerLastName;
    String itemName;
    /** Verbatim form fields as received, for the ledger snapshot. */
    Map<String, String> rawFields;

    public boolean isComplete() {
        return paymentStatus == GatewayPaymentStatus.COMPLETE;
    }
}
