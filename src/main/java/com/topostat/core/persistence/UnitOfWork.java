package com.topostat.core.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dimension rows created for one record, in creation order (parents first),
 * plus the fact row referencing them. Committed atomically by a {@link ResultStore}.
 */
public class UnitOfWork {

    private final List<Dimension> created = new ArrayList<>();
    private ResultFact fact;

    /** Queues a new dimension row for persistence and returns it. */
    public <T extends Dimension> T create(T dimension) {
        created.add(Objects.requireNonNull(dimension, "dimension"));
        return dimension;
    }

    public void setFact(ResultFact fact) {
        this.fact = fact;
    }

    public List<Dimension> getCreated() {
        return Collections.unmodifiableList(created);
    }

    public ResultFact getFact() {
        return fact;
    }

    /** Resets surrogate ids after a failed commit so the rows read as unpersisted again. */
    void rollbackIds() {
        for (Dimension dimension : created) {
            dimension.clearId();
        }
        if (fact != null) {
            fact.clearId();
        }
    }
}
