package com.flagship.procurement_ledger.chat;

import lombok.Value;

@Value
public class SendPhoto implements OutboundMessage {
    String identity;
    String attachmentHandle;
    String caption;
}
