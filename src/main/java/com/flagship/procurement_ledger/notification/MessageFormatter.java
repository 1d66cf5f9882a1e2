package com.flagship.procurement_ledger.notification;

import com.flagship.procurement_ledger.ledger.FulfillmentState;
import com.flagship.procurement_ledger.ledger.LedgerRequest;
import com.flagship.procurement_ledger.ledger.LedgerTimestamps;
import com.flagship.procurement_ledger.ledger.NewRequest;
import com.flagship.procurement_ledger.ledger.OrderNumber;
import com.flagship.procurement_ledger.ledger.WeeklySummary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders every text the bot sends, to requesters and to the admin chat.
 *
 * Output is plain text; the transport decides about markup.
 */
@Component
public class MessageFormatter {

    public static final String GLYPH_FULFILLED = "✅";
    public static final String GLYPH_CANCELLED = "❌";
    public static final String GLYPH_PENDING = "⏳";

    private static final String ABORT_HINT = "(/abort to stop)";
    private static final String ARTICLE_PROMPT = "📦 1/5: Which article?";
    private static final String QUANTITY_PROMPT = "🔢 2/5: What quantity?";
    private static final String URGENCY_PROMPT = "⏰ 3/5: Urgent or normal?";
    private static final String COST_CENTER_PROMPT = "💰 4/5: Which cost center is this request for?";
    private static final String ATTACHMENT_PROMPT = "📸 5/5: Would you like to attach a photo?\n\n"
            + "Send a photo or tap /skip to continue without one.";

    // Order flow

    public String welcome(String displayName) {
        return "👋 Hello " + displayName + "!\n\n"
                + "I help you record procurement requests.\n\n"
                + ARTICLE_PROMPT + "\n\n"
                + ABORT_HINT;
    }

    public String restartPrompt() {
        return "👋 New request:\n\n" + ARTICLE_PROMPT + "\n\n" + ABORT_HINT;
    }

    public String orderAlreadyInProgress() {
        return "ℹ️ You already have a request in progress. "
                + "Continue below, or use /abort to discard it.";
    }

    public String articlePrompt() {
        return ARTICLE_PROMPT;
    }

    public String quantityPrompt() {
        return QUANTITY_PROMPT;
    }

    public String urgencyPrompt() {
        return URGENCY_PROMPT;
    }

    public String costCenterPrompt() {
        return COST_CENTER_PROMPT;
    }

    public String attachmentPrompt() {
        return ATTACHMENT_PROMPT;
    }

    public String articleAccepted(String article) {
        return "✅ Article: " + article + "\n\n" + QUANTITY_PROMPT;
    }

    public String quantityAccepted(String quantity) {
        return "✅ Quantity: " + quantity + "\n\n" + URGENCY_PROMPT;
    }

    public String urgencyAccepted(String urgency) {
        return "✅ Urgency: " + urgency + "\n\n" + COST_CENTER_PROMPT;
    }

    public String costCenterAccepted(String costCenter) {
        return "✅ Cost center: " + costCenter + "\n\n" + ATTACHMENT_PROMPT;
    }

    public String emptyInput() {
        return "Please enter a value.";
    }

    public String urgencyRejected() {
        return "⚠️ Please choose one of the offered options.\n\n" + URGENCY_PROMPT;
    }

    public String costCenterRejected(List<String> costCenters) {
        return "⚠️ Unknown cost center. Please choose one of: "
                + String.join(", ", costCenters) + "\n\n" + COST_CENTER_PROMPT;
    }

    public String photoReceived() {
        return "📸 Photo received!";
    }

    public String photoNotExpected() {
        return "No photo expected right now.";
    }

    public String skipNotExpected() {
        return "There is nothing to skip right now.";
    }

    public String confirmationSummary(NewRequest request) {
        return "📋 Request summary:\n\n"
                + requestDetails(request)
                + "\n\n❓ Is everything correct?";
    }

    public String confirmationPending() {
        return "Please confirm, start over or abort using the buttons below.";
    }

    public String confirmSubmitLabel() {
        return "✅ Confirm & submit";
    }

    public String confirmRestartLabel() {
        return "✏️ Start over";
    }

    public String abortLabel() {
        return "❌ Abort";
    }

    public String submitted(OrderNumber orderNumber, NewRequest request) {
        return "✅ Request " + orderNumber.format() + " recorded!\n\n"
                + requestDetails(request) + "\n\n"
                + "You will be notified once it has been ordered.\n\n"
                + "📋 /pending - Your open requests\n"
                + "🆕 /start - New request";
    }

    public String submitFailed() {
        return "❌ Your request could not be saved!\n\n"
                + "Please try again later or contact the administrator.\n\n"
                + "For a new request: /start";
    }

    public String requestAborted() {
        return "❌ Request aborted.\n\nFor a new request: /start";
    }

    public String nothingToAbort() {
        return "There is nothing to abort.";
    }

    public String selectionExpired() {
        return "This selection is no longer active.";
    }

    public String noActiveFlow() {
        return "Send /start to record a new request or /help for all commands.";
    }

    // Pending and cancellation

    public String noPending() {
        return "📋 You have no open requests.\n\n/start - Place a new request";
    }

    public String pendingList(List<LedgerRequest> pending) {
        StringBuilder message = new StringBuilder("📋 Your open requests:\n\n");
        for (LedgerRequest request : pending) {
            message.append(request.getOrderNumber()).append(" - ").append(request.getArticle()).append('\n')
                   .append("   Quantity: ").append(request.getQuantity())
                   .append(" | ").append(request.getUrgency()).append('\n')
                   .append("   Cost center: ").append(request.getCostCenter()).append('\n')
                   .append("   Date: ").append(request.getCreatedAt()).append("\n\n");
        }
        message.append("/withdraw - Cancel a request");
        return message.toString();
    }

    public String noPendingToCancel() {
        return "📋 You have no open requests to cancel.\n\n/start - Place a new request";
    }

    public String cancellationPrompt() {
        return "🗑️ Which request would you like to cancel?\n\nChoose a request:";
    }

    public String cancellationOptionLabel(LedgerRequest request) {
        return request.getOrderNumber() + " - " + request.getArticle();
    }

    public String cancellationPending() {
        return "Please choose a request from the list above, or /abort.";
    }

    public String cancelled(LedgerRequest request) {
        return "✅ Request " + request.getOrderNumber() + " has been cancelled.\n\n"
                + "📦 " + request.getArticle() + " x " + request.getQuantity() + "\n\n"
                + "/pending - Open requests\n"
                + "/start - New request";
    }

    public String cancelFailed() {
        return "❌ Cancelling failed. Please try again later.";
    }

    public String cancellationAborted() {
        return "❌ Cancellation aborted.";
    }

    public String notCancellable() {
        return "❌ That request is not among your open requests.";
    }

    // Search and statistics

    public String searchUsage() {
        return "🔍 Search requests\n\n"
                + "Usage: /search <term>\n\n"
                + "Examples:\n"
                + "- /search printer paper\n"
                + "- /search IT\n"
                + "- /search Max";
    }

    public String searchNoResults(String term) {
        return "🔍 No results for '" + term + "'\n\nTry a different search term.";
    }

    public String searchResults(String term, List<LedgerRequest> results) {
        StringBuilder message = new StringBuilder("🔍 Search results for '").append(term).append("':\n\n");
        for (LedgerRequest request : results) {
            message.append(statusGlyph(request.state())).append(' ')
                   .append(request.getOrderNumber()).append(" - ").append(request.getArticle()).append('\n')
                   .append("   ").append(request.getRequesterName())
                   .append(" | ").append(request.getQuantity())
                   .append(" | ").append(request.getCostCenter()).append('\n')
                   .append("   ").append(request.getCreatedAt()).append("\n\n");
        }
        return message.toString().stripTrailing();
    }

    public String statistics(WeeklySummary summary) {
        return "📊 Weekly overview\n\n" + summaryBody(summary);
    }

    public String weeklySummaryForAdmin(WeeklySummary summary) {
        return "📅 Weekly summary\n"
                + LedgerTimestamps.formatFulfilledAt(summary.getWindowStart()) + " to "
                + LedgerTimestamps.formatFulfilledAt(summary.getWindowEnd()) + "\n\n"
                + summaryBody(summary);
    }

    public String ledgerUnavailable() {
        return "❌ The request ledger is currently unavailable. Please try again later.";
    }

    public String statisticsUnavailable() {
        return "❌ Error loading the statistics.";
    }

    // Misc commands

    public String myIdentity(String identity) {
        return "🔑 Your chat id: " + identity + "\n\n"
                + "To receive admin notifications, configure:\n"
                + "PROCUREMENT_ADMIN_CHAT_ID=" + identity;
    }

    public String help() {
        return "🤖 Procurement bot help\n\n"
                + "Commands:\n"
                + "/start - Start a new procurement request\n"
                + "/pending - Show your open requests\n"
                + "/withdraw - Cancel one of your requests\n"
                + "/search <term> - Search requests\n"
                + "/stats - Weekly overview\n"
                + "/abort - Abort the current request\n"
                + "/myid - Show your chat id\n"
                + "/help - Show this help\n\n"
                + "If you run into problems, contact your administrator.";
    }

    public String unknownCommand(String name) {
        return "Unknown command /" + name + ". Send /help for all commands.";
    }

    // Admin notifications

    public String adminNewRequest(RequestSubmittedEvent event) {
        return "🆕 New request " + event.getOrderNumber() + "\n\n"
                + "👤 From: " + event.getRequesterName() + "\n"
                + "📦 Article: " + event.getArticle() + "\n"
                + "🔢 Quantity: " + event.getQuantity() + "\n"
                + "⏰ Urgency: " + event.getUrgency() + "\n"
                + "💰 Cost center: " + event.getCostCenter();
    }

    public String adminAttachmentCaption(String orderNumber) {
        return "📸 Photo for request " + orderNumber;
    }

    public String adminCancelled(RequestCancelledEvent event) {
        return "🗑️ Request " + event.getOrderNumber() + " CANCELLED\n\n"
                + "👤 By: " + event.getCancelledBy() + "\n"
                + "📦 Article: " + event.getArticle() + "\n"
                + "🔢 Quantity: " + event.getQuantity();
    }

    public static String statusGlyph(FulfillmentState state) {
        return switch (state) {
            case FULFILLED -> GLYPH_FULFILLED;
            case CANCELLED -> GLYPH_CANCELLED;
            case PENDING -> GLYPH_PENDING;
        };
    }

    private String requestDetails(NewRequest request) {
        String details = "📦 Article: " + request.getArticle() + "\n"
                + "🔢 Quantity: " + request.getQuantity() + "\n"
                + "⏰ Urgency: " + request.getUrgency().label() + "\n"
                + "💰 Cost center: " + request.getCostCenter();
        if (request.hasAttachment()) {
            details += "\n📸 Photo: attached";
        }
        return details;
    }

    private String summaryBody(WeeklySummary summary) {
        StringBuilder message = new StringBuilder()
                .append("📦 Total: ").append(summary.getTotal()).append(" requests\n")
                .append(GLYPH_PENDING).append(" Open: ").append(summary.getPending()).append('\n')
                .append(GLYPH_FULFILLED).append(" Ordered: ").append(summary.getFulfilled()).append('\n')
                .append(GLYPH_CANCELLED).append(" Cancelled: ").append(summary.getCancelled());

        Map<String, Integer> byCostCenter = summary.getByCostCenter();
        if (byCostCenter != null && !byCostCenter.isEmpty()) {
            message.append("\n\nBy cost center:");
            byCostCenter.forEach((costCenter, count) ->
                    message.append("\n  ").append(costCenter).append(": ").append(count));
        }
        return message.toString();
    }
}
