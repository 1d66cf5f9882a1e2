package com.flagship.procurement_ledger.conversation;

import com.flagship.procurement_ledger.ledger.NewRequest;
import com.flagship.procurement_ledger.ledger.Urgency;
import lombok.Getter;

/**
 * Fields collected so far by an order flow.
 *
 * Each setter stores one answer and advances to the next stage; the draft is only
 * touched by its owner's event sequence, so it is not synchronized.
 */
@Getter
public class OrderDraft implements FlowState {

    private OrderStage stage = OrderStage.ARTICLE;
    private String article;
    private String quantity;
    private Urgency urgency;
    private String costCenter;
    private String attachmentReference;

    @Override
    public FlowKind kind() {
        return FlowKind.ORDER;
    }

    public boolean isAt(OrderStage expected) {
        return stage == expected;
    }

    void acceptArticle(String value) {
        expect(OrderStage.ARTICLE);
        this.article = value;
        this.stage = OrderStage.QUANTITY;
    }

    void acceptQuantity(String value) {
        expect(OrderStage.QUANTITY);
        this.quantity = value;
        this.stage = OrderStage.URGENCY;
    }

    void acceptUrgency(Urgency value) {
        expect(OrderStage.URGENCY);
        this.urgency = value;
        this.stage = OrderStage.COST_CENTER;
    }

    void acceptCostCenter(String value) {
        expect(OrderStage.COST_CENTER);
        this.costCenter = value;
        this.stage = OrderStage.ATTACHMENT;
    }

    void acceptAttachment(String attachmentHandle) {
        expect(OrderStage.ATTACHMENT);
        this.attachmentReference = attachmentHandle;
        this.stage = OrderStage.CONFIRM;
    }

    void skipAttachment() {
        expect(OrderStage.ATTACHMENT);
        this.attachmentReference = null;
        this.stage = OrderStage.CONFIRM;
    }

    /**
     * Clears all answers and returns to the first stage.
     */
    void restart() {
        this.stage = OrderStage.ARTICLE;
        this.article = null;
        this.quantity = null;
        this.urgency = null;
        this.costCenter = null;
        this.attachmentReference = null;
    }

    NewRequest toRequest(String requesterName, String requesterIdentity) {
        expect(OrderStage.CONFIRM);
        return NewRequest.builder()
                .requesterName(requesterName)
                .requesterIdentity(requesterIdentity)
                .article(article)
                .quantity(quantity)
                .urgency(urgency)
                .costCenter(costCenter)
                .attachmentReference(attachmentReference)
                .build();
    }

    private void expect(OrderStage expected) {
        if (stage != expected) {
            throw new IllegalStateException("Order draft is at " + stage + ", not " + expected);
        }
    }
}
