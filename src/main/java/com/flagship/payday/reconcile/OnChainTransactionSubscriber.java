package com.flagship.payday.reconcile;

import com.flagship.payday.node.NodeSubscription;
import com.flagship.payday.node.OnChainNode;
import com.flagship.payday.node.notification.OnChainTransactionNotification;
import com.flagship.payday.offset.OffsetStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

/**
 * Follows wallet transactions. The stored offset is the block height of the last transaction
 * that reached the confirmation threshold; resubscribing from it (inclusive) redelivers that
 * block, which the aggregates absorb as no-ops.
 */
@Component
@ConditionalOnProperty(name = "payday.subscriber.enabled", havingValue = "true", matchIfMissing = true)
public class OnChainTransactionSubscriber extends NodeSubscriber<OnChainTransactionNotification> {

    public static final String OFFSET_ID = "onchain.block-height";

    private final OnChainNode onChainNode;
    private final int minConfirmations;

    public OnChainTransactionSubscriber(NodeReconciler reconciler,
                                        OffsetStore offsetStore,
                                        OnChainNode onChainNode,
                                        @Value("${payday.on-chain.min-confirmations:1}") int minConfirmations) {
        super(reconciler, offsetStore);
        this.onChainNode = onChainNode;
        this.minConfirmations = minConfirmations;
    }

    @Override
    protected String offsetId() {
        return OFFSET_ID;
    }

    @Override
    protected NodeSubscription subscribe(long fromOffset, Consumer<OnChainTransactionNotification> listener) {
        return onChainNode.subscribeTransactions(fromOffset, listener);
    }

    @Override
    protected long offsetOf(OnChainTransactionNotification notification) {
        return notification.getConfirmations() >= minConfirmations ? notification.getBlockHeight() : -1;
    }

    @Override
    @Scheduled(fixedDelayString = "${payday.subscriber.check-interval-ms:5000}")
    public void ensureSubscribed() {
        super.ensureSubscribed();
    }
}
