package com.flagship.payday.node.simulated;

import com.flagship.payday.node.NodeSubscription;

import java.util.List;
import java.util.function.Consumer;

/**
 * Subscription backed by a listener list; closing removes the listener.
 */
class ListenerSubscription<T> implements NodeSubscription {

    private final List<Consumer<T>> listeners;
    private final Consumer<T> listener;

    ListenerSubscription(List<Consumer<T>> listeners, Consumer<T> listener) {
        this.listeners = listeners;
        this.listener = listener;
    }

    @Override
    public boolean isActive() {
        return listeners.contains(listener);
    }

    @Override
    public void close() {
        listeners.remove(listener);
    }
}
