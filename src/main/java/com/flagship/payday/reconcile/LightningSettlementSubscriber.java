package com.flagship.payday.reconcile;

import com.flagship.payday.node.LightningNode;
import com.flagship.payday.node.NodeSubscription;
import com.flagship.payday.node.notification.InvoiceSettlementNotification;
import com.flagship.payday.offset.OffsetStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Follows invoice settlements on the Lightning node, resuming after the last reconciled
 * settle index.
 */
@Component
@ConditionalOnProperty(name = "payday.subscriber.enabled", havingValue = "true", matchIfMissing = true)
public class LightningSettlementSubscriber extends NodeSubscriber<InvoiceSettlementNotification> {

    public static final String OFFSET_ID = "lightning.settle-index";

    private final LightningNode lightningNode;

    public LightningSettlementSubscriber(NodeReconciler reconciler, OffsetStore offsetStore, LightningNode lightningNode) {
        super(reconciler, offsetStore);
        this.lightningNode = lightningNode;
    }

    @Override
    protected String offsetId() {
        return OFFSET_ID;
    }

    @Override
    protected NodeSubscription subscribe(long fromOffset, Consumer<InvoiceSettlementNotification> listener) {
        return lightningNode.subscribeSettlements(fromOffset, listener);
    }

    @Override
    protected long offsetOf(InvoiceSettlementNotification notification) {
        return notification.getSettleIndex();
    }

    @Override
    @Scheduled(fixedDelayString = "${payday.subscriber.check-interval-ms:5000}")
    public void ensureSubscribed() {
        super.ensureSubscribed();
    }
}
