package com.topostat.core.persistence;

/**
 * Base class of the normalized reference rows. The surrogate id is {@code null}
 * until the row has been committed by a {@link ResultStore}.
 */
public abstract class Dimension {

    private Long id;

    public Long getId() {
        return id;
    }

    public boolean isPersisted() {
        return id != null;
    }

    void assignId(long id) {
        this.id = id;
    }

    void clearId() {
        this.id = null;
    }

    public abstract DimensionType type();

    public abstract NaturalKey naturalKey();

    /** Post-construction validity: non-empty names, positive numbers, valid parents. */
    public abstract boolean isValid();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", key=" + naturalKey() + "]";
    }
}
