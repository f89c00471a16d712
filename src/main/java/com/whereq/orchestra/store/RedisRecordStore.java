package com.whereq.orchestra.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orchestra.exception.RecordNotFoundException;
import com.whereq.orchestra.model.PersistentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Redis-backed record store.
 *
 * <p>Layout per record: {@code <prefix>:<kind>:<id>} holds the JSON document and
 * {@code <prefix>:<kind>:<id>:attrs} is a hash of attribute fields, changed with HINCRBY / HSET.
 */
@Slf4j
public class RedisRecordStore<T extends PersistentRecord> implements RecordStore<T> {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final RecordCodec<T> codec;
    private final String kind;
    private final String keyPrefix;

    public RedisRecordStore(ReactiveRedisTemplate<String, String> redisTemplate,
                            ObjectMapper objectMapper,
                            String keyPrefix,
                            String kind,
                            Class<T> type,
                            Set<String> attributeFields) {
        this.redisTemplate = redisTemplate;
        this.codec = new RecordCodec<>(objectMapper, type, attributeFields);
        this.kind = kind;
        this.keyPrefix = keyPrefix + ":" + kind + ":";
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Mono<T> create(T record) {
        return Mono.defer(() -> {
            if (record.getId() == null) {
                record.setId(UUID.randomUUID().toString());
            }
            Instant now = Instant.now();
            record.setCreatedAt(now);
            record.setUpdatedAt(now);

            String json = codec.toJson(record);
            Map<String, String> attributes = codec.initialAttributes(record);

            Mono<Boolean> writeAttributes = attributes.isEmpty()
                ? Mono.just(true)
                : redisTemplate.opsForHash().putAll(attributesKey(record.getId()), attributes);

            return redisTemplate.opsForValue()
                .setIfAbsent(documentKey(record.getId()), json)
                .flatMap(created -> {
                    if (!Boolean.TRUE.equals(created)) {
                        return Mono.error(new IllegalStateException(
                            kind + " " + record.getId() + " already exists"));
                    }
                    return writeAttributes;
                })
                .doOnSuccess(v -> log.debug("Created {} {}", kind, record.getId()))
                .thenReturn(record);
        });
    }

    @Override
    public Mono<T> findById(String id) {
        return redisTemplate.opsForValue()
            .get(documentKey(id))
            .zipWith(readAttributes(id))
            .map(tuple -> codec.fromJson(tuple.getT1(), tuple.getT2()));
    }

    @Override
    public Mono<T> save(T record) {
        return Mono.defer(() -> {
            record.setUpdatedAt(Instant.now());
            String json = codec.toJson(record);
            return redisTemplate.opsForValue()
                .setIfPresent(documentKey(record.getId()), json)
                .flatMap(updated -> Boolean.TRUE.equals(updated)
                    ? Mono.just(record)
                    : Mono.error(new RecordNotFoundException(kind, record.getId())));
        });
    }

    @Override
    public Mono<Long> increment(String id, String field, long delta) {
        requireAttribute(field);
        return redisTemplate.hasKey(documentKey(id))
            .flatMap(exists -> exists
                ? redisTemplate.opsForHash().increment(attributesKey(id), field, delta)
                : Mono.error(new RecordNotFoundException(kind, id)));
    }

    @Override
    public Mono<Void> updateField(String id, String field, String value) {
        requireAttribute(field);
        return redisTemplate.hasKey(documentKey(id))
            .flatMap(exists -> exists
                ? redisTemplate.opsForHash().put(attributesKey(id), field, value)
                : Mono.error(new RecordNotFoundException(kind, id)))
            .then();
    }

    private Mono<Map<String, String>> readAttributes(String id) {
        return redisTemplate.<String, String>opsForHash()
            .entries(attributesKey(id))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private void requireAttribute(String field) {
        if (!codec.isAttribute(field)) {
            throw new IllegalArgumentException(field + " is not an attribute field of " + kind);
        }
    }

    private String documentKey(String id) {
        return keyPrefix + id;
    }

    private String attributesKey(String id) {
        return keyPrefix + id + ":attrs";
    }
}
