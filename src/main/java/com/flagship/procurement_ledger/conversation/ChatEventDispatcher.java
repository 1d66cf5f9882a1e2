package com.flagship.procurement_ledger.conversation;

import com.flagship.procurement_ledger.chat.ChatDeliveryException;
import com.flagship.procurement_ledger.chat.ChatEvent;
import com.flagship.procurement_ledger.chat.ChatGateway;
import com.flagship.procurement_ledger.chat.CommandMessage;
import com.flagship.procurement_ledger.chat.PhotoMessage;
import com.flagship.procurement_ledger.chat.SelectionMessage;
import com.flagship.procurement_ledger.chat.SendText;
import com.flagship.procurement_ledger.chat.TextMessage;
import com.flagship.procurement_ledger.notification.MessageFormatter;
import com.flagship.procurement_ledger.notification.RequestReporting;
import com.flagship.procurement_ledger.observability.CorrelationContext;
import com.flagship.procurement_ledger.observability.ProcurementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for inbound chat events.
 *
 * Routes each event to the flow the sender currently has open, or to a
 * stand-alone command. Query commands (pending, search, stats, help, myid)
 * never touch the sender's flow. Starting a flow replaces a flow of the other
 * kind; {@code /start} during a running order flow keeps that flow.
 *
 * Replies that cannot be delivered are logged and dropped: the ledger state
 * has already changed and replaying the event would repeat that change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatEventDispatcher {

    private final SessionStore sessions;
    private final OrderConversation orders;
    private final CancellationConversation cancellations;
    private final RequestReporting reporting;
    private final ChatGateway gateway;
    private final MessageFormatter formatter;
    private final ProcurementMetrics metrics;

    public void dispatch(ChatEvent event) {
        MDC.put(CorrelationContext.IDENTITY_MDC_KEY, event.getIdentity());
        metrics.recordChatEvent(event.getEventType());

        try {
            if (event instanceof CommandMessage command) {
                onCommand(command);
            } else if (event instanceof TextMessage text) {
                onText(text);
            } else if (event instanceof PhotoMessage photo) {
                onPhoto(photo);
            } else if (event instanceof SelectionMessage selection) {
                onSelection(selection);
            } else {
                log.warn("Unsupported chat event type {}", event.getClass().getSimpleName());
            }
        } catch (ChatDeliveryException e) {
            log.error("Reply to {} could not be delivered: {}", event.getIdentity(), e.getMessage());
            metrics.recordReplyFailure();
        } finally {
            MDC.remove(CorrelationContext.IDENTITY_MDC_KEY);
        }
    }

    private void onCommand(CommandMessage message) {
        String identity = message.getIdentity();
        Optional<ChatCommand> command = ChatCommand.fromName(message.getName());
        if (command.isEmpty()) {
            reply(identity, formatter.unknownCommand(message.getName()));
            return;
        }

        log.debug("Command {} from {}", command.get(), identity);
        switch (command.get()) {
            case START -> orders.start(message);
            case PENDING -> reporting.showPending(identity);
            case WITHDRAW -> cancellations.start(message);
            case SEARCH -> reporting.search(identity, message.argumentText());
            case STATS -> reporting.showStatistics(identity);
            case ABORT -> abort(identity);
            case MY_ID -> reply(identity, formatter.myIdentity(identity));
            case HELP -> reply(identity, formatter.help());
            case SKIP -> {
                Optional<OrderDraft> draft = sessions.current(identity, OrderDraft.class);
                if (draft.isPresent()) {
                    orders.onSkip(message, draft.get());
                } else {
                    reply(identity, formatter.skipNotExpected());
                }
            }
        }
    }

    private void onText(TextMessage message) {
        Optional<FlowState> state = sessions.current(message.getIdentity());
        if (state.isEmpty()) {
            reply(message.getIdentity(), formatter.noActiveFlow());
            return;
        }
        if (state.get() instanceof OrderDraft draft) {
            orders.onText(message, draft);
        } else {
            reply(message.getIdentity(), formatter.cancellationPending());
        }
    }

    private void onPhoto(PhotoMessage message) {
        Optional<OrderDraft> draft = sessions.current(message.getIdentity(), OrderDraft.class);
        if (draft.isPresent()) {
            orders.onPhoto(message, draft.get());
        } else {
            reply(message.getIdentity(), formatter.photoNotExpected());
        }
    }

    private void onSelection(SelectionMessage message) {
        Optional<FlowState> state = sessions.current(message.getIdentity());
        if (state.isPresent() && state.get() instanceof OrderDraft draft) {
            orders.onSelection(message, draft);
        } else if (state.isPresent() && state.get() instanceof CancellationSelection selection) {
            cancellations.onSelection(message, selection);
        } else {
            reply(message.getIdentity(), formatter.selectionExpired());
        }
    }

    private void abort(String identity) {
        Optional<FlowState> state = sessions.current(identity);
        if (state.isEmpty()) {
            reply(identity, formatter.nothingToAbort());
            return;
        }
        switch (state.get().kind()) {
            case ORDER -> orders.abort(identity);
            case CANCELLATION -> cancellations.abort(identity);
        }
    }

    private void reply(String identity, String text) {
        gateway.send(SendText.of(identity, text));
    }
}
