package com.karting.entries.persistence.service;

import lombok.Value;

/**
 * Row returned by an idempotent insert, flagged with whether this call created it.
 */
@Value
public class StoreResult<T> {

    T row;
    boolean created;

    public static <T> StoreResult<T> created(T row) {
        return new StoreResult<>(row, true);
    }

    public static <T> StoreResult<T> existing(T row) {
        return new StoreResult<>(row, false);
    }
}
