package com.flagship.payday.reconcile;

import java.util.Optional;
import java.util.UUID;

/**
 * Maps a node's reference for a payment (payment hash, address, transaction id) to the
 * aggregate that owns it. A reference is written before the first event that carries it.
 */
public interface PaymentReferenceIndex {

    /**
     * Registers the mapping unless the reference is already taken.
     *
     * @return the owning aggregate id: {@code aggregateId} if the mapping is new or already
     *         existed, otherwise the aggregate that registered the reference first
     */
    UUID register(String reference, UUID aggregateId);

    Optional<UUID> find(String reference);

    /**
     * Moves a reference to a new owner if it still belongs to {@code expectedOwner}.
     *
     * @return true if the reference now belongs to {@code newOwner}
     */
    boolean reassign(String reference, UUID expectedOwner, UUID newOwner);
}
