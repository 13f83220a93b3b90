package com.karting.entries.core;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class AdminReconcileRequest {

    String paymentReference;
    String payerEmail;
    String payerFirstName;
    String payerLastName;
    BigDecimal amount;
    /** Gateway payment id when the operator has it; otherwise one is derived from the reference. */
    String pfPaymentId;
    String actor;
}
