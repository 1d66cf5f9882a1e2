package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.ledger.LedgerOutcome;
import com.flagship.procurement_ledger.ledger.RequestLedger;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Manually triggered weekly summary for the admin chat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklySummaryService {

    public enum PushResult {
        DELIVERED,
        DELIVERY_FAILED,
        LEDGER_UNAVAILABLE,
        NOT_CONFIGURED
    }

    private final RequestLedger ledger;
    private final AdminNotificationService adminNotifications;

    public LedgerOutcome<WeeklySummary> currentSummary() {
        return ledger.weeklyAggregate();
    }

    public PushResult pushToAdmin() {
        if (!adminNotifications.isConfigured()) {
            log.warn("Weekly summary requested but no admin chat is configured");
            return PushResult.NOT_CONFIGURED;
        }

        LedgerOutcome<WeeklySummary> summary = ledger.weeklyAggregate();
        if (!summary.isAvailable()) {
            return PushResult.LEDGER_UNAVAILABLE;
        }

        boolean delivered = adminNotifications.sendWeeklySummary(summary.getValue());
        log.info("Weekly summary pushed to admin: total={}, delivered={}", summary.getValue().getTotal(), delivered);
        return delivered ? PushResult.DELIVERED : PushResult.DELIVERY_FAILED;
    }
}
