package com.flagship.payday.reconcile;

import com.flagship.payday.node.NodeSubscription;
import com.flagship.payday.node.notification.NodeNotification;
import com.flagship.payday.observability.CorrelationContext;
import com.flagship.payday.offset.OffsetStore;
import com.flagship.payday.payment.InvalidTransitionException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Keeps one node subscription open, feeds its notifications to the reconciler and stores how far
 * it got under {@link #offsetId()}.
 *
 * A notification that fails to reconcile closes the subscription without moving the offset.
 * {@link #ensureSubscribed()} then resubscribes from the stored offset, so the node redelivers
 * it. Redelivered notifications are no-ops for the aggregate. A notification that contradicts
 * the aggregate is logged and passed over.
 */
@Slf4j
public abstract class NodeSubscriber<T extends NodeNotification> {

    private final NodeReconciler reconciler;
    private final OffsetStore offsetStore;
    private final Object lock = new Object();
    private NodeSubscription subscription;

    protected NodeSubscriber(NodeReconciler reconciler, OffsetStore offsetStore) {
        this.reconciler = reconciler;
        this.offsetStore = offsetStore;
    }

    /**
     * Name of the cursor in the offset store.
     */
    protected abstract String offsetId();

    protected abstract NodeSubscription subscribe(long fromOffset, Consumer<T> listener);

    /**
     * Offset to store once {@code notification} was reconciled, or a negative value to leave the
     * stored offset as it is.
     */
    protected abstract long offsetOf(T notification);

    /**
     * Opens the subscription if there is none or the previous one was dropped.
     */
    public void ensureSubscribed() {
        synchronized (lock) {
            if (subscription != null && subscription.isActive()) {
                return;
            }
            long offset = offsetStore.get(offsetId());
            log.info("Subscribing {} from offset {}", offsetId(), offset);
            AtomicBoolean failed = new AtomicBoolean(false);
            try {
                subscription = subscribe(offset, notification -> onNotification(notification, failed));
            } catch (RuntimeException e) {
                subscription = null;
                log.warn("Subscription {} failed to open: {}", offsetId(), e.getMessage());
            }
        }
    }

    public boolean isSubscribed() {
        synchronized (lock) {
            return subscription != null && subscription.isActive();
        }
    }

    @PreDestroy
    public void close() {
        synchronized (lock) {
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
        }
    }

    private void onNotification(T notification, AtomicBoolean failed) {
        if (failed.get()) {
            return;
        }

        CorrelationContext.begin(null);
        try {
            try {
                ReconcileOutcome outcome = reconciler.reconcile(notification);
                log.debug("Reconciled {} {}: {}", offsetId(), notification.getReference(), outcome);
            } catch (InvalidTransitionException e) {
                // Redelivery would contradict the aggregate again
                log.error("Node notification for {} contradicts payment {}, skipping: {}",
                    notification.getReference(), e.getAggregateId(), e.getMessage());
            }
            long offset = offsetOf(notification);
            if (offset >= 0) {
                offsetStore.save(offsetId(), offset);
            }
        } catch (RuntimeException e) {
            failed.set(true);
            log.error("Failed to reconcile {} notification for {}, resubscribing later: {}", offsetId(),
                notification.getReference(), e.getMessage(), e);
            dropSubscription();
        } finally {
            CorrelationContext.end();
        }
    }

    private void dropSubscription() {
        synchronized (lock) {
            if (subscription != null) {
                subscription.close();
                subscription = null;
            }
        }
    }
}
