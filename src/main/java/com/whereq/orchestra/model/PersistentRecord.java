package com.whereq.orchestra.model;

import java.time.Instant;

/**
 * Common shape of everything kept in a {@link com.whereq.orchestra.store.RecordStore}.
 */
public interface PersistentRecord {

    String getId();

    void setId(String id);

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    void setUpdatedAt(Instant updatedAt);
}
