package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.chat.ChatGateway;
import com.flagship.procurement_ledger.chat.OutboundMessage;
import com.flagship.procurement_ledger.chat.SendPhoto;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import com.flagship.procurement_ledger.observability.CorrelationContext;
import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Pushes request events to the admin chat.
 *
 * Delivery is fire-and-forget on the notification executor: a failure is
 * logged and counted, never retried, and never reaches the requester.
 * Without a configured admin chat nothing is sent.
 */
@Service
@Slf4j
public class AdminNotificationService {

    private final ChatGateway gateway;
    private final MessageFormatter formatter;
    private final ProcurementMetrics metrics;
    private final String adminChatId;

    public AdminNotificationService(ChatGateway gateway,
                                    MessageFormatter formatter,
                                    ProcurementMetrics metrics,
                                    @Value("${procurement.admin-chat-id:}") String adminChatId) {
        this.gateway = gateway;
        this.formatter = formatter;
        this.metrics = metrics;
        this.adminChatId = adminChatId == null ? "" : adminChatId.strip();
    }

    public boolean isConfigured() {
        return !adminChatId.isEmpty();
    }

    @Async("notificationExecutor")
    @EventListener
    public void onRequestSubmitted(RequestSubmittedEvent event) {
        if (!isConfigured()) {
            return;
        }
        MDC.put(CorrelationContext.ORDER_NUMBER_MDC_KEY, event.getOrderNumber());
        try {
            deliver(event.getEventType(), SendText.of(adminChatId, formatter.adminNewRequest(event)));

            // The photo goes out separately; losing it does not affect the text.
            if (event.hasAttachment()) {
                deliver("RequestAttachment", new SendPhoto(adminChatId, event.getAttachmentReference(),
                        formatter.adminAttachmentCaption(event.getOrderNumber())));
            }
        } finally {
            MDC.remove(CorrelationContext.ORDER_NUMBER_MDC_KEY);
        }
    }

    @Async("notificationExecutor")
    @EventListener
    public void onRequestCancelled(RequestCancelledEvent event) {
        if (!isConfigured()) {
            return;
        }
        MDC.put(CorrelationContext.ORDER_NUMBER_MDC_KEY, event.getOrderNumber());
        try {
            deliver(event.getEventType(), SendText.of(adminChatId, formatter.adminCancelled(event)));
        } finally {
            MDC.remove(CorrelationContext.ORDER_NUMBER_MDC_KEY);
        }
    }

    /**
     * Sends the weekly summary on the caller's thread.
     *
     * @return true if the transport accepted the message
     */
    public boolean sendWeeklySummary(WeeklySummary summary) {
        if (!isConfigured()) {
            throw new IllegalStateException("No admin chat configured");
        }
        return deliver("WeeklySummary", SendText.of(adminChatId, formatter.weeklySummaryForAdmin(summary)));
    }

    private boolean deliver(String kind, OutboundMessage message) {
        try {
            gateway.send(message);
            metrics.recordAdminNotification(kind, true);
            log.debug("Admin notification {} delivered", kind);
            return true;
        } catch (RuntimeException e) {
            log.error("Could not notify admin ({}): {}", kind, e.getMessage());
            metrics.recordAdminNotification(kind, false);
            return false;
        }
    }
}
