package com.flagship.procurement_ledger.conversation;

import java.util.Optional;

/**
 * Answers to the confirmation prompt that closes the order flow.
 */
public enum ConfirmationChoice {
    SUBMIT("confirm:submit"),
    RESTART("confirm:restart"),
    ABORT("confirm:abort");

    public static final String TOKEN_PREFIX = "confirm:";

    private final String token;

    ConfirmationChoice(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<ConfirmationChoice> fromToken(String token) {
        for (ConfirmationChoice choice : values()) {
            if (choice.token.equals(token)) {
                return Optional.of(choice);
            }
        }
        return Optional.empty();
    }
}
