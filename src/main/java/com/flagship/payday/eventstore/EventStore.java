package com.flagship.payday.eventstore;

import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Append-only event log keyed by (aggregate type, aggregate id, sequence).
 *
 * Sequences in a stream start at 1 and are contiguous. Uniqueness of the key is what enforces
 * optimistic concurrency: of two writers appending at the same expected sequence exactly one wins.
 *
 * Streams returned by the load methods are lazy and must be closed by the caller.
 */
public interface EventStore {

    /**
     * Appends a batch to a stream atomically. The first event gets sequence
     * {@code expectedLastSequence + 1}.
     *
     * @throws ConcurrencyConflictException if the stream's last sequence is not
     *         {@code expectedLastSequence}, or another writer raced us to the same sequence
     * @throws StorageException on backend failure
     * @throws IllegalArgumentException if the batch is empty
     */
    List<StoredEvent> append(String aggregateType, UUID aggregateId, long expectedLastSequence,
                             List<NewEvent> events);

    /**
     * Events of one stream with {@code sequence > afterSequence}, ascending.
     */
    Stream<StoredEvent> load(String aggregateType, UUID aggregateId, long afterSequence);

    /**
     * Events of all streams with {@code global_position > afterPosition}, ascending by global position.
     */
    Stream<StoredEvent> loadAllSince(long afterPosition, int maxEvents);

    /**
     * Last sequence of a stream, 0 if it has no events.
     */
    long lastSequence(String aggregateType, UUID aggregateId);

    /**
     * Highest global position written so far, 0 for an empty log.
     */
    long lastGlobalPosition();
}
