package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.chat.SendPhoto;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.ledger.NewRequest;
import com.flagship.procurement_ledger.ledger.OrderNumber;
import com.flagship.procurement_ledger.ledger.Urgency;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import com.flagship.procurement_ledger.support.LedgerFixtures;
import com.flagship.procurement_ledger.support.RecordingChatGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AdminNotificationServiceTest {

    private static final String ADMIN = "admin-7";

    private RecordingChatGateway gateway;
    private SimpleMeterRegistry registry;
    private AdminNotificationService service;

    @BeforeEach
    void setUp() {
        gateway = new RecordingChatGateway();
        registry = new SimpleMeterRegistry();
        service = new AdminNotificationService(gateway, new MessageFormatter(),
                new ProcurementMetrics(registry), ADMIN);
    }

    @Test
    @DisplayName("New request is announced to the admin chat")
    void testSubmittedText() {
        service.onRequestSubmitted(submitted(null));

        assertEquals(1, gateway.sent().size());
        SendText text = (SendText) gateway.last();
        assertEquals(ADMIN, text.getIdentity());
        assertTrue(text.getText().startsWith("🆕 New request #004"));
        assertTrue(text.getText().contains("Urgent"));
        assertEquals(1.0, registry.get("procurement.admin.notifications")
                .tag("kind", RequestSubmittedEvent.EVENT_TYPE).tag("status", "delivered").counter().count());
    }

    @Test
    @DisplayName("Attachment follows the text as a photo")
    void testSubmittedWithPhoto() {
        service.onRequestSubmitted(submitted("file-123"));

        assertEquals(2, gateway.sent().size());
        assertInstanceOf(SendText.class, gateway.sent().get(0));
        SendPhoto photo = (SendPhoto) gateway.sent().get(1);
        assertEquals("file-123", photo.getAttachmentHandle());
        assertEquals("📸 Photo for request #004", photo.getCaption());
    }

    @Test
    @DisplayName("Delivery failure is counted and not thrown")
    void testDeliveryFailure() {
        gateway.setFailing(true);

        assertDoesNotThrow(() -> service.onRequestSubmitted(submitted(null)));

        assertEquals(1.0, registry.get("procurement.admin.notifications")
                .tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("Without an admin chat nothing is sent")
    void testNotConfigured() {
        AdminNotificationService unconfigured = new AdminNotificationService(gateway, new MessageFormatter(),
                new ProcurementMetrics(registry), "  ");

        unconfigured.onRequestSubmitted(submitted("file-123"));

        assertFalse(unconfigured.isConfigured());
        assertTrue(gateway.sent().isEmpty());
        assertThrows(IllegalStateException.class, () -> unconfigured.sendWeeklySummary(summary()));
    }

    @Test
    @DisplayName("Weekly summary reports delivery")
    void testWeeklySummary() {
        assertTrue(service.sendWeeklySummary(summary()));
        assertTrue(gateway.lastText().startsWith("📅 Weekly summary"));

        gateway.setFailing(true);
        assertFalse(service.sendWeeklySummary(summary()));
    }

    private static RequestSubmittedEvent submitted(String attachment) {
        NewRequest request = NewRequest.builder()
                .requesterName("Anna")
                .requesterIdentity("U1")
                .article("Toner")
                .quantity("3")
                .urgency(Urgency.URGENT)
                .costCenter("HR")
                .attachmentReference(attachment)
                .build();
        return RequestSubmittedEvent.of(OrderNumber.of(4), request, Instant.parse("2024-05-15T08:30:00Z"));
    }

    private static WeeklySummary summary() {
        return WeeklySummary.builder()
                .windowStart(LedgerFixtures.NOW.minusDays(2).toLocalDate().atStartOfDay())
                .windowEnd(LedgerFixtures.NOW)
                .total(1)
                .pending(1)
                .byCostCenter(Map.of("HR", 1))
                .build();
    }
}
