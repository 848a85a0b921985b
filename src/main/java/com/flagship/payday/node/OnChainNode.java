package com.flagship.payday.node;

import com.flagship.payday.node.notification.OnChainTransactionNotification;
import com.flagship.payday.payment.Amount;

import java.util.function.Consumer;

/**
 * Bitcoin wallet backend.
 */
public interface OnChainNode {

    String nodeId();

    String newAddress();

    /**
     * Broadcasts a payment and returns its transaction id.
     */
    String send(String address, Amount amount);

    /**
     * Delivers wallet transactions from {@code fromBlockHeight} (inclusive) and unconfirmed ones,
     * then new transactions and confirmations as they happen.
     */
    NodeSubscription subscribeTransactions(long fromBlockHeight, Consumer<OnChainTransactionNotification> listener);
}
