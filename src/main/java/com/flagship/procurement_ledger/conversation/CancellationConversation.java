package com.flagship.procurement_ledger.conversation;

import com.flagship.procurement_ledger.chat.ChatEvent;
import com.flagship.procurement_ledger.chat.ChatGateway;
import com.flagship.procurement_ledger.chat.ChoiceOption;
import com.flagship.procurement_ledger.chat.OfferChoices;
import com.flagship.procurement_ledger.chat.SelectionMessage;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.ledger.LedgerOutcome;
import com.flagship.procurement_ledger.ledger.LedgerRequest;
import com.flagship.procurement_ledger.ledger.RequestLedger;
import com.flagship.procurement_ledger.notification.MessageFormatter;
import com.flagship.procurement_ledger.notification.RequestCancelledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The cancellation flow. Offers the caller's pending requests as choices and
 * cancels the selected one. Its single state is SELECTING; it is never entered
 * when there is nothing to cancel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CancellationConversation {

    public static final String TOKEN_PREFIX = "cancel:";
    public static final String ABORT_TOKEN = TOKEN_PREFIX + "abort";

    private final SessionStore sessions;
    private final RequestLedger ledger;
    private final ChatGateway gateway;
    private final MessageFormatter formatter;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public void start(ChatEvent event) {
        String identity = event.getIdentity();

        LedgerOutcome<List<LedgerRequest>> outcome = ledger.listPending(identity);
        if (!outcome.isAvailable()) {
            reply(identity, formatter.ledgerUnavailable());
            return;
        }

        List<LedgerRequest> pending = outcome.getValue();
        if (pending.isEmpty()) {
            reply(identity, formatter.noPendingToCancel());
            return;
        }

        sessions.begin(identity, new CancellationSelection(pending));

        List<ChoiceOption> options = new ArrayList<>();
        for (LedgerRequest request : pending) {
            options.add(new ChoiceOption(formatter.cancellationOptionLabel(request), token(request)));
        }
        options.add(new ChoiceOption(formatter.abortLabel(), ABORT_TOKEN));

        gateway.send(new OfferChoices(identity, formatter.cancellationPrompt(), options));
    }

    public void onSelection(SelectionMessage message, CancellationSelection selection) {
        String identity = message.getIdentity();
        String token = message.getChoiceToken();

        if (ABORT_TOKEN.equals(token)) {
            abort(identity);
            return;
        }

        Optional<Integer> rowPosition = parseRowPosition(token);
        if (rowPosition.isEmpty()) {
            log.debug("Ignoring selection '{}' from {} during cancellation", token, identity);
            reply(identity, formatter.cancellationPending());
            return;
        }

        sessions.end(identity);

        Optional<LedgerRequest> chosen = selection.find(rowPosition.get());
        if (chosen.isEmpty()) {
            log.warn("Identity {} selected row {} which was not offered to it", identity, rowPosition.get());
            reply(identity, formatter.notCancellable());
            return;
        }

        LedgerRequest request = chosen.get();
        if (!ledger.cancel(request.getRowPosition())) {
            reply(identity, formatter.cancelFailed());
            return;
        }

        log.info("Request {} cancelled by {}", request.getOrderNumber(), identity);
        events.publishEvent(RequestCancelledEvent.of(request, message.getDisplayName(), Instant.now(clock)));
        reply(identity, formatter.cancelled(request));
    }

    public void abort(String identity) {
        sessions.end(identity);
        reply(identity, formatter.cancellationAborted());
    }

    static String token(LedgerRequest request) {
        return TOKEN_PREFIX + request.getRowPosition();
    }

    private static Optional<Integer> parseRowPosition(String token) {
        if (token == null || !token.startsWith(TOKEN_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(token.substring(TOKEN_PREFIX.length())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private void reply(String identity, String text) {
        gateway.send(SendText.of(identity, text));
    }
}
