package com.karting.entries.domain;

import lombok.Value;

import java.util.Map;

/**
 * Form the browser must POST to the hosted payment page. Field order is significant for the
 * signature, so {@link #fields} preserves insertion order.
 */
@Value
public class GatewayForm {

    String gatewayUrl;
    Map<String, String> fields;
    String paymentReference;
}
