package com.karting.entries.domain;

public enum EntryStatus {
    PENDING_PAYMENT,
    CONFIRMED,
    CANCELLED
}
