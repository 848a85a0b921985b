package com.flagship.payday.node.simulated;

import com.flagship.payday.node.NodeException;
import com.flagship.payday.node.NodeSubscription;
import com.flagship.payday.node.OnChainNode;
import com.flagship.payday.node.notification.OnChainTransactionNotification;
import com.flagship.payday.payment.Amount;
import com.flagship.payday.payment.PaymentDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process Bitcoin wallet for development and tests.
 *
 * Transactions enter the mempool with {@link #send} or {@link #receive} and confirm with
 * {@link #mineBlock()}. Every change is pushed to subscribers as an
 * {@link OnChainTransactionNotification}.
 */
@Component
@ConditionalOnProperty(name = "payday.node.type", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedOnChainNode implements OnChainNode {

    private final String nodeId;
    private final Clock clock;
    private final Object lock = new Object();
    private final AtomicLong addressCounter = new AtomicLong();
    private final Map<String, OnChainTransactionNotification> transactions = new LinkedHashMap<>();
    private final List<Consumer<OnChainTransactionNotification>> listeners = new CopyOnWriteArrayList<>();
    private long blockHeight;
    private NodeException queuedFailure;

    public SimulatedOnChainNode(@Value("${payday.node.simulated.onchain-node-id:sim-onchain}") String nodeId,
                                Clock clock) {
        this.nodeId = nodeId;
        this.clock = clock;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public String newAddress() {
        throwQueuedFailure();
        return String.format("bcrt1qsim%012d", addressCounter.incrementAndGet());
    }

    @Override
    public String send(String address, Amount amount) {
        throwQueuedFailure();
        if (address == null || !address.startsWith("bcrt1")) {
            throw new NodeException(nodeId, "Invalid address: " + address);
        }
        if (amount == null || amount.value() <= 0) {
            throw new NodeException(nodeId, "Invalid amount: " + amount);
        }
        return record(PaymentDirection.OUTGOING, address, amount);
    }

    @Override
    public NodeSubscription subscribeTransactions(long fromBlockHeight,
                                                  Consumer<OnChainTransactionNotification> listener) {
        List<OnChainTransactionNotification> backlog;
        synchronized (lock) {
            backlog = transactions.values().stream()
                .filter(tx -> tx.getBlockHeight() == 0 || tx.getBlockHeight() >= fromBlockHeight)
                .toList();
            listeners.add(listener);
        }
        backlog.forEach(listener);
        return new ListenerSubscription<>(listeners, listener);
    }

    // ==================== Simulation hooks ====================

    /**
     * Puts a payment to one of our addresses into the mempool.
     */
    public String receive(String address, Amount amount) {
        return record(PaymentDirection.INCOMING, address, amount);
    }

    /**
     * Mines a block: mempool transactions confirm at the new height and every confirmed
     * transaction gains one confirmation.
     *
     * @return the new block height
     */
    public long mineBlock() {
        List<OnChainTransactionNotification> changed = new ArrayList<>();
        long height;
        synchronized (lock) {
            height = ++blockHeight;
            for (Map.Entry<String, OnChainTransactionNotification> entry : transactions.entrySet()) {
                OnChainTransactionNotification tx = entry.getValue();
                long minedAt = tx.getBlockHeight() == 0 ? height : tx.getBlockHeight();
                OnChainTransactionNotification updated = tx.toBuilder()
                    .blockHeight(minedAt)
                    .confirmations((int) (height - minedAt + 1))
                    .observedAt(clock.instant())
                    .build();
                entry.setValue(updated);
                changed.add(updated);
            }
        }
        changed.forEach(tx -> listeners.forEach(listener -> listener.accept(tx)));
        return height;
    }

    public void failNextCall(NodeException failure) {
        synchronized (lock) {
            queuedFailure = failure;
        }
    }

    public long getBlockHeight() {
        synchronized (lock) {
            return blockHeight;
        }
    }

    private String record(PaymentDirection direction, String address, Amount amount) {
        String txid = (UUID.randomUUID().toString() + UUID.randomUUID()).replace("-", "");
        OnChainTransactionNotification tx = OnChainTransactionNotification.builder()
            .direction(direction)
            .address(address)
            .transactionId(txid)
            .amount(amount)
            .confirmations(0)
            .blockHeight(0)
            .observedAt(clock.instant())
            .build();
        synchronized (lock) {
            transactions.put(txid, tx);
        }
        log.debug("Simulated {} transaction {}: address={}, amount={}", direction, txid, address, amount);
        listeners.forEach(listener -> listener.accept(tx));
        return txid;
    }

    private void throwQueuedFailure() {
        NodeException failure;
        synchronized (lock) {
            failure = queuedFailure;
            queuedFailure = null;
        }
        if (failure != null) {
            throw failure;
        }
    }
}
