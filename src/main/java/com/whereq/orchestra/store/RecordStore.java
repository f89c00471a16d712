package com.whereq.orchestra.store;

import com.whereq.orchestra.model.PersistentRecord;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Persistence for one record kind.
 *
 * <p>Records are stored as a JSON document plus a set of attribute fields. Attribute fields are
 * declared per kind and change only through {@link #increment} and {@link #updateField}, which are
 * atomic in every implementation; {@link #save} never overwrites them.
 *
 * @param <T> record type
 */
public interface RecordStore<T extends PersistentRecord> {

    /**
     * Record kind, used in keys and error messages
     */
    String kind();

    /**
     * Persist a new record. Assigns an id when absent and stamps created/updated times.
     */
    Mono<T> create(T record);

    /**
     * @return the record, or empty when the id is unknown
     */
    Mono<T> findById(String id);

    /**
     * Overwrite the document of an existing record and stamp its updated time.
     */
    Mono<T> save(T record);

    /**
     * Atomically add {@code delta} to a numeric attribute field
     *
     * @return the value after the increment
     */
    Mono<Long> increment(String id, String field, long delta);

    /**
     * Atomically set a single attribute field
     */
    Mono<Void> updateField(String id, String field, String value);

    default Mono<Void> updateField(String id, String field, Instant value) {
        return updateField(id, field, value.toString());
    }
}
