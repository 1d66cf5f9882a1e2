package com.flagship.procurement_ledger.chat;

import lombok.Value;

@Value
public class ChoiceOption {
    String label;
    String token;
}
