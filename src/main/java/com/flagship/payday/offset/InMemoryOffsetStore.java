package com.flagship.payday.offset;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
@ConditionalOnProperty(name = "payday.store.type", havingValue = "memory")
@Slf4j
public class InMemoryOffsetStore implements OffsetStore {

    private final Map<String, Long> offsets = new ConcurrentHashMap<>();

    @Override
    public long get(String id) {
        return offsets.getOrDefault(id, 0L);
    }

    @Override
    public boolean save(String id, long offset) {
        AtomicBoolean advanced = new AtomicBoolean(false);
        offsets.compute(id, (key, current) -> {
            if (current == null || offset > current) {
                advanced.set(true);
                return offset;
            }
            if (offset < current) {
                log.warn("Ignoring attempt to move offset {} backwards: current={}, requested={}", id, current, offset);
            }
            return current;
        });
        return advanced.get();
    }

    @Override
    public Map<String, Long> findAll() {
        return new TreeMap<>(offsets);
    }
}
