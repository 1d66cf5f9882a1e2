package com.flagship.procurement_ledger.conversation;

import com.flagship.procurement_ledger.chat.ChatEvent;
import com.flagship.procurement_ledger.chat.ChatGateway;
import com.flagship.procurement_ledger.chat.ChoiceOption;
import com.flagship.procurement_ledger.chat.OfferChoices;
import com.flagship.procurement_ledger.chat.PhotoMessage;
import com.flagship.procurement_ledger.chat.SelectionMessage;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.chat.TextMessage;
import com.flagship.procurement_ledger.ledger.LedgerOutcome;
import com.flagship.procurement_ledger.ledger.NewRequest;
import com.flagship.procurement_ledger.ledger.OrderNumber;
import com.flagship.procurement_ledger.ledger.RequestLedger;
import com.flagship.procurement_ledger.ledger.Urgency;
import com.flagship.procurement_ledger.notification.MessageFormatter;
import com.flagship.procurement_ledger.notification.RequestSubmittedEvent;
import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The order flow: collects article, quantity, urgency, cost center and an
 * optional photo, then asks for confirmation before appending to the ledger.
 *
 * <pre>
 * ARTICLE → QUANTITY → URGENCY → COST_CENTER → ATTACHMENT → CONFIRM
 * </pre>
 *
 * Urgency and cost center are closed sets; other input is refused and the
 * stage is asked again. The flow ends on submit (successful or not) and on abort.
 * Restart clears the draft and goes back to ARTICLE.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderConversation {

    private final SessionStore sessions;
    private final RequestLedger ledger;
    private final CostCenterCatalog costCenters;
    private final ChatGateway gateway;
    private final MessageFormatter formatter;
    private final ApplicationEventPublisher events;
    private final ProcurementMetrics metrics;
    private final Clock clock;

    /**
     * Enters ARTICLE. An order flow that is already running is kept as is.
     */
    public void start(ChatEvent event) {
        String identity = event.getIdentity();
        Optional<OrderDraft> existing = sessions.current(identity, OrderDraft.class);
        if (existing.isPresent()) {
            reply(identity, formatter.orderAlreadyInProgress());
            promptStage(identity, existing.get());
            return;
        }

        sessions.begin(identity, new OrderDraft());
        log.info("Order flow started by {}", identity);
        reply(identity, formatter.welcome(event.getDisplayName()));
    }

    public void onText(TextMessage message, OrderDraft draft) {
        String identity = message.getIdentity();
        String input = message.getText() == null ? "" : message.getText().strip();

        switch (draft.getStage()) {
            case ARTICLE -> {
                if (rejectBlank(identity, input, OrderStage.ARTICLE)) {
                    return;
                }
                draft.acceptArticle(input);
                reply(identity, formatter.articleAccepted(input));
            }
            case QUANTITY -> {
                if (rejectBlank(identity, input, OrderStage.QUANTITY)) {
                    return;
                }
                draft.acceptQuantity(input);
                offerUrgency(identity, formatter.quantityAccepted(input));
            }
            case URGENCY -> {
                Optional<Urgency> urgency = Urgency.fromInput(input);
                if (urgency.isEmpty()) {
                    log.warn("Rejected urgency '{}' from {}", input, identity);
                    metrics.recordRejectedInput("urgency");
                    offerUrgency(identity, formatter.urgencyRejected());
                    return;
                }
                acceptUrgency(identity, draft, urgency.get());
            }
            case COST_CENTER -> {
                Optional<String> costCenter = costCenters.resolve(input);
                if (costCenter.isEmpty()) {
                    log.warn("Rejected cost center '{}' from {}", input, identity);
                    metrics.recordRejectedInput("cost_center");
                    gateway.send(new SendText(identity,
                            formatter.costCenterRejected(costCenters.options()), costCenters.options()));
                    return;
                }
                draft.acceptCostCenter(costCenter.get());
                reply(identity, formatter.costCenterAccepted(costCenter.get()));
            }
            case ATTACHMENT -> reply(identity, formatter.attachmentPrompt());
            case CONFIRM -> {
                reply(identity, formatter.confirmationPending());
                offerConfirmation(message, draft);
            }
        }
    }

    public void onPhoto(PhotoMessage message, OrderDraft draft) {
        String identity = message.getIdentity();
        if (!draft.isAt(OrderStage.ATTACHMENT)) {
            reply(identity, formatter.photoNotExpected());
            promptStage(identity, draft);
            return;
        }
        draft.acceptAttachment(message.getAttachmentHandle());
        reply(identity, formatter.photoReceived());
        offerConfirmation(message, draft);
    }

    public void onSkip(ChatEvent event, OrderDraft draft) {
        if (!draft.isAt(OrderStage.ATTACHMENT)) {
            reply(event.getIdentity(), formatter.skipNotExpected());
            promptStage(event.getIdentity(), draft);
            return;
        }
        draft.skipAttachment();
        offerConfirmation(event, draft);
    }

    /**
     * Handles urgency and confirmation tokens. Tokens that do not fit the current
     * stage come from an older prompt and are refused.
     */
    public void onSelection(SelectionMessage message, OrderDraft draft) {
        String identity = message.getIdentity();
        String token = message.getChoiceToken();

        Optional<Urgency> urgency = Urgency.fromToken(token);
        if (urgency.isPresent() && draft.isAt(OrderStage.URGENCY)) {
            acceptUrgency(identity, draft, urgency.get());
            return;
        }

        Optional<ConfirmationChoice> choice = ConfirmationChoice.fromToken(token);
        if (choice.isPresent() && draft.isAt(OrderStage.CONFIRM)) {
            switch (choice.get()) {
                case SUBMIT -> submit(message, draft);
                case RESTART -> {
                    draft.restart();
                    log.info("Order flow restarted by {}", identity);
                    reply(identity, formatter.restartPrompt());
                }
                case ABORT -> abort(identity);
            }
            return;
        }

        log.debug("Ignoring selection '{}' from {} at stage {}", token, identity, draft.getStage());
        reply(identity, formatter.selectionExpired());
        promptStage(identity, draft);
    }

    public void abort(String identity) {
        sessions.end(identity);
        log.info("Order flow aborted by {}", identity);
        reply(identity, formatter.requestAborted());
    }

    private void submit(ChatEvent event, OrderDraft draft) {
        String identity = event.getIdentity();
        NewRequest request = draft.toRequest(event.getDisplayName(), identity);

        // The flow ends whatever the outcome; a failed submit is not retried.
        sessions.end(identity);

        LedgerOutcome<OrderNumber> outcome = ledger.append(request);
        if (!outcome.isAvailable()) {
            reply(identity, formatter.submitFailed());
            return;
        }

        // Published before the reply so an undeliverable reply cannot suppress it.
        OrderNumber orderNumber = outcome.getValue();
        events.publishEvent(RequestSubmittedEvent.of(orderNumber, request, Instant.now(clock)));
        reply(identity, formatter.submitted(orderNumber, request));
    }

    private void acceptUrgency(String identity, OrderDraft draft, Urgency urgency) {
        draft.acceptUrgency(urgency);
        gateway.send(new SendText(identity, formatter.urgencyAccepted(urgency.label()), costCenters.options()));
    }

    private boolean rejectBlank(String identity, String input, OrderStage stage) {
        if (!input.isEmpty()) {
            return false;
        }
        metrics.recordRejectedInput(stage.name().toLowerCase(Locale.ROOT));
        reply(identity, formatter.emptyInput());
        return true;
    }

    /**
     * Repeats the question of the current stage.
     */
    private void promptStage(String identity, OrderDraft draft) {
        switch (draft.getStage()) {
            case ARTICLE -> reply(identity, formatter.articlePrompt());
            case QUANTITY -> reply(identity, formatter.quantityPrompt());
            case URGENCY -> offerUrgency(identity, formatter.urgencyPrompt());
            case COST_CENTER -> gateway.send(new SendText(identity, formatter.costCenterPrompt(), costCenters.options()));
            case ATTACHMENT -> reply(identity, formatter.attachmentPrompt());
            case CONFIRM -> offerConfirmation(identity, draft.toRequest("", identity));
        }
    }

    private void offerUrgency(String identity, String prompt) {
        List<ChoiceOption> options = Arrays.stream(Urgency.values())
                .map(urgency -> new ChoiceOption(urgency.label(), urgency.token()))
                .toList();
        gateway.send(new OfferChoices(identity, prompt, options));
    }

    private void offerConfirmation(ChatEvent event, OrderDraft draft) {
        offerConfirmation(event.getIdentity(), draft.toRequest(event.getDisplayName(), event.getIdentity()));
    }

    private void offerConfirmation(String identity, NewRequest request) {
        gateway.send(new OfferChoices(identity, formatter.confirmationSummary(request), List.of(
                new ChoiceOption(formatter.confirmSubmitLabel(), ConfirmationChoice.SUBMIT.token()),
                new ChoiceOption(formatter.confirmRestartLabel(), ConfirmationChoice.RESTART.token()),
                new ChoiceOption(formatter.abortLabel(), ConfirmationChoice.ABORT.token())
        )));
    }

    private void reply(String identity, String text) {
        gateway.send(SendText.of(identity, text));
    }
}
