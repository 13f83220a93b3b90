package com.karting.entries.core;

import com.karting.entries.domain.GatewayCheckout;
import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.PaymentReference;
import com.karting.entries.domain.WebhookNotification;

import java.util.Map;

/**
 * What a hosted-redirect payment gateway integration needs to implement.
 * The only place where externally formatted payment data becomes trusted.
 */
public interface GatewayAdapter {

    default String getGatewayName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Build the form the browser posts to the gateway. Nothing is sent from here.
     *
     * @throws com.karting.entries.api.GatewayConstructionException when the form cannot be assembled
     */
    GatewayForm buildCheckoutForm(GatewayCheckout checkout);

    /**
     * Verify the notification signature, then normalise the known fields.
     *
     * @param payload form fields as received
     * @param headers request headers as received
     * @throws com.karting.entries.api.SignatureInvalidException when the signature does not verify
     */
    WebhookNotification verifyNotification(Map<String, String> payload, Map<String, String> headers);

    /** Which reference namespace a value belongs to. */
    default PaymentReference classify(String paymentReference) {
        return PaymentReference.parse(paymentReference);
    }
}
