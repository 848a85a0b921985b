package com.flagship.payday.reconcile;

import com.flagship.payday.eventstore.StorageException;
import com.flagship.payday.payment.PaymentAggregate;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "jdbc", matchIfMissing = true)
@RequiredArgsConstructor
public class JdbcPaymentReferenceIndex implements PaymentReferenceIndex {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public UUID register(String reference, UUID aggregateId) {
        try {
            jdbcTemplate.update(
                "INSERT INTO payment_references (node_reference, aggregate_type, aggregate_id, created_at) " +
                "VALUES (?, ?, ?, CURRENT_TIMESTAMP) ON CONFLICT (node_reference) DO NOTHING",
                reference,
                PaymentAggregate.AGGREGATE_TYPE,
                aggregateId
            );
            return find(reference).orElseThrow(() ->
                new StorageException("Reference " + reference + " missing right after registration"));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to register reference " + reference, e);
        }
    }

    @Override
    public Optional<UUID> find(String reference) {
        try {
            List<UUID> owners = jdbcTemplate.queryForList(
                "SELECT aggregate_id FROM payment_references WHERE node_reference = ?",
                UUID.class,
                reference
            );
            return owners.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to look up reference " + reference, e);
        }
    }

    @Override
    public boolean reassign(String reference, UUID expectedOwner, UUID newOwner) {
        try {
            int updated = jdbcTemplate.update(
                "UPDATE payment_references SET aggregate_id = ?, created_at = CURRENT_TIMESTAMP " +
                "WHERE node_reference = ? AND aggregate_id = ?",
                newOwner,
                reference,
                expectedOwner
            );
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to reassign reference " + reference, e);
        }
    }
}
