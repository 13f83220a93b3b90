package com.karting.entries.mail;

import lombok.Value;

import java.time.Instant;

/**
 * One high-frequency admin notification waiting to be summarised.
 */
@Value
public class AdminActivity {

    String action;
    String subjectId;
    String detail;
    Instant occurredAt;
}
