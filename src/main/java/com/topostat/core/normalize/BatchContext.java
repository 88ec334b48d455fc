package com.topostat.core.normalize;

import com.topostat.core.persistence.Dimension;
import com.topostat.core.persistence.NaturalKey;
import com.topostat.core.persistence.UnitOfWork;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-batch identity cache of dimension rows, keyed by natural key.
 * <p>
 * Holds rows created earlier in the same batch (committed or not) as well as rows
 * already fetched from the store, so a key introduced twice in one batch always
 * resolves to the same instance. One context lives for exactly one envelope and is
 * not thread-safe.
 */
public class BatchContext {

    private final Map<NaturalKey, Dimension> entries = new HashMap<>();

    public <T extends Dimension> Optional<T> get(NaturalKey key, Class<T> type) {
        Dimension cached = entries.get(key);
        return type.isInstance(cached) ? Optional.of(type.cast(cached)) : Optional.empty();
    }

    public void put(Dimension dimension) {
        entries.put(dimension.naturalKey(), dimension);
    }

    /**
     * Drops the rows a failed unit of work created, so later records in the batch
     * resolve them again instead of referencing rows that were never written.
     */
    public void evict(UnitOfWork work) {
        for (Dimension dimension : work.getCreated()) {
            entries.remove(dimension.naturalKey(), dimension);
        }
    }

    public int size() {
        return entries.size();
    }
}
