package com.flagship.procurement_ledger.ledger;

import lombok.Value;

/**
 * Human-readable order number, rendered as {@code #} followed by the sequence
 * value zero-padded to three digits ({@code #001}, {@code #042}, {@code #1000}).
 */
@Value
public class OrderNumber {
    long value;

    private OrderNumber(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Order number must be positive, got " + value);
        }
        this.value = value;
    }

    public static OrderNumber of(long value) {
        return new OrderNumber(value);
    }

    public String format() {
        return String.format("#%03d", value);
    }

    @Override
    public String toString() {
        return format();
    }
}
