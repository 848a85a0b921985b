package com.flagship.payday.node;

/**
 * Handle to a live node subscription. Closing it stops delivery.
 */
public interface NodeSubscription extends AutoCloseable {

    boolean isActive();

    @Override
    void close();
}
