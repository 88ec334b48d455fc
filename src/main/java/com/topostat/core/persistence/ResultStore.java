package com.topostat.core.persistence;

import com.topostat.core.model.ResultRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational store of dimension and fact rows.
 * <p>
 * Reads that cannot reach the store throw {@link org.springframework.dao.DataAccessException}.
 */
public interface ResultStore {

    /**
     * Looks up a committed dimension row by its natural key.
     */
    <T extends Dimension> Optional<T> find(NaturalKey key, Class<T> type);

    /**
     * Persists the new dimension rows and the fact of {@code work} atomically.
     * On failure nothing of the unit is kept and all ids it assigned are cleared.
     */
    void commit(UnitOfWork work) throws PersistenceException;

    /**
     * Returns the stored results of {@code plan} with timestamps in {@code [from, to]},
     * ordered by ascending timestamp.
     */
    List<ResultRecord> findResults(String plan, Instant from, Instant to);

    long countResults();

    long countDimensions(DimensionType type);
}
