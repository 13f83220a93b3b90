package com.karting.entries.api.dto;

import com.karting.entries.domain.PaymentStatus;
import lombok.Data;

@Data
public class CancelEntryRequestDto {

    /** Payment status the operator saw; the cancel fails if the entry has moved on since. */
    private PaymentStatus expectedStatus;
}
