package com.karting.entries.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What the browser is about to pay for. Input to the outbound half of the gateway adapter.
 */
@Value
@Builder
public class GatewayCheckout {

    String paymentReference;
    BigDecimal amount;
    String itemName;
    String itemDescription;
    String returnUrl;
    String cancelUrl;
    String notifyUrl;
    String payerEmail;
    String payerFirstName;
    String payerLastName;
}
