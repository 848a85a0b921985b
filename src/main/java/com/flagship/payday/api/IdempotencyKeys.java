package com.flagship.payday.api;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Maps an Idempotency-Key header to the aggregate id it creates, so a retried request lands
 * on the same stream.
 */
public final class IdempotencyKeys {

    public static final String HEADER = "Idempotency-Key";

    private IdempotencyKeys() {
    }

    static UUID aggregateId(String scope, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency-Key must not be blank");
        }
        return UUID.nameUUIDFromBytes((scope + ":" + idempotencyKey.trim()).getBytes(StandardCharsets.UTF_8));
    }
}
