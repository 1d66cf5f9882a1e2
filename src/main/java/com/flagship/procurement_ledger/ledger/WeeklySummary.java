package com.flagship.procurement_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Request counts for the window from Monday 00:00 of the current week up to now.
 * Invariant: {@code pending + fulfilled + cancelled == total}.
 */
@Value
@Builder
public class WeeklySummary {
    LocalDateTime windowStart;
    LocalDateTime windowEnd;
    int total;
    int pending;
    int fulfilled;
    int cancelled;
    Map<String, Integer> byCostCenter;
}
