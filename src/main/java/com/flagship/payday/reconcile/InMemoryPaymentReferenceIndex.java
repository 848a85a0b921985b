package com.flagship.payday.reconcile;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "memory")
public class InMemoryPaymentReferenceIndex implements PaymentReferenceIndex {

    private final Map<String, UUID> owners = new ConcurrentHashMap<>();

    @Override
    public UUID register(String reference, UUID aggregateId) {
        UUID existing = owners.putIfAbsent(reference, aggregateId);
        return existing != null ? existing : aggregateId;
    }

    @Override
    public Optional<UUID> find(String reference) {
        return Optional.ofNullable(owners.get(reference));
    }

    @Override
    public boolean reassign(String reference, UUID expectedOwner, UUID newOwner) {
        return owners.replace(reference, expectedOwner, newOwner);
    }
}
