package com.karting.entries.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ReconcileRequestDto {

    @NotBlank(message = "paymentReference is required")
    private String paymentReference;

    private String payerEmail;
    private String payerFirstName;
    private String payerLastName;

    @DecimalMin("0.00")
    private BigDecimal amount;

    private String pfPaymentId;
}
