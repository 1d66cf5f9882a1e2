package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.ledger.LedgerOutcome;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for the weekly summary. There is no scheduler: whoever
 * wants the summary in the admin chat calls the POST endpoint.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final WeeklySummaryService weeklySummaries;

    @GetMapping("/weekly-summary")
    public ResponseEntity<WeeklySummary> weeklySummary() {
        LedgerOutcome<WeeklySummary> summary = weeklySummaries.currentSummary();
        if (!summary.isAvailable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return ResponseEntity.ok(summary.getValue());
    }

    @PostMapping("/weekly-summary")
    public ResponseEntity<Map<String, String>> pushWeeklySummary() {
        WeeklySummaryService.PushResult result = weeklySummaries.pushToAdmin();
        HttpStatus status = switch (result) {
            case DELIVERED -> HttpStatus.OK;
            case DELIVERY_FAILED -> HttpStatus.BAD_GATEWAY;
            case LEDGER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case NOT_CONFIGURED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(Map.of("result", result.name()));
    }
}
