package com.whereq.orchestra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.PersistentRecord;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process record store. Keeps serialized documents so callers never share mutable instances,
 * and applies attribute changes through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryRecordStore<T extends PersistentRecord> implements RecordStore<T> {

    private final RecordCodec<T> codec;
    private final String kind;
    private final Map<String, String> documents = new ConcurrentHashMap<>();
    private final Map<String, Map<String, String>> attributes = new ConcurrentHashMap<>();

    public InMemoryRecordStore(ObjectMapper objectMapper, String kind, Class<T> type, Set<String> attributeFields) {
        this.codec = new RecordCodec<>(objectMapper, type, attributeFields);
        this.kind = kind;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Mono<T> create(T record) {
        return Mono.fromCallable(() -> {
            if (record.getId() == null) {
                record.setId(UUID.randomUUID().toString());
            }
            Instant now = Instant.now();
            record.setCreatedAt(now);
            record.setUpdatedAt(now);
            String json = codec.toJson(record);
            if (documents.putIfAbsent(record.getId(), json) != null) {
                throw new IllegalStateException(kind + " " + record.getId() + " already exists");
            }
            attributes.put(record.getId(), new ConcurrentHashMap<>(codec.initialAttributes(record)));
            return record;
        });
    }

    @Override
    public Mono<T> findById(String id) {
        return Mono.fromCallable(() -> {
            String json = documents.get(id);
            if (json == null) {
                return null;
            }
            return codec.fromJson(json, Map.copyOf(attributes.getOrDefault(id, Map.of())));
        });
    }

    @Override
    public Mono<T> save(T record) {
        return Mono.fromCallable(() -> {
            record.setUpdatedAt(Instant.now());
            String json = codec.toJson(record);
            if (documents.computeIfPresent(record.getId(), (id, previous) -> json) == null) {
                throw new RecordNotFoundException(kind, record.getId());
            }
            return record;
        });
    }

    @Override
    public Mono<Long> increment(String id, String field, long delta) {
        return Mono.fromCallable(() -> {
            requireAttribute(field);
            Map<String, String> fields = attributesOf(id);
            String updated = fields.merge(field, Long.toString(delta),
                (current, added) -> Long.toString(Long.parseLong(current) + Long.parseLong(added)));
            return Long.parseLong(updated);
        });
    }

    @Override
    public Mono<Void> updateField(String id, String field, String value) {
        return Mono.fromRunnable(() -> {
            requireAttribute(field);
            attributesOf(id).put(field, value);
        });
    }

    /**
     * Number of records held, for tests and diagnostics
     */
    public int size() {
        return documents.size();
    }

    private Map<String, String> attributesOf(String id) {
        if (!documents.containsKey(id)) {
            throw new RecordNotFoundException(kind, id);
        }
        return attributes.computeIfAbsent(id, key -> new ConcurrentHashMap<>());
    }

    private void requireAttribute(String field) {
        if (!codec.isAttribute(field)) {
            throw new IllegalArgumentException(field + " is not an attribute field of " + kind);
        }
    }
}
