package com.topostat.core.persistence;

import com.topostat.core.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Non-durable {@link ResultStore} used when no DataSource is configured.
 * Contents are lost on restart.
 */
public class InMemoryResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultStore.class);

    private final Map<NaturalKey, Dimension> dimensions = new HashMap<>();
    private final List<ResultFact> facts = new ArrayList<>();
    private final AtomicLong dimensionIds = new AtomicLong();
    private final AtomicLong factIds = new AtomicLong();

    @Override
    public synchronized <T extends Dimension> Optional<T> find(NaturalKey key, Class<T> type) {
        Dimension found = dimensions.get(key);
        if (type.isInstance(found)) {
            return Optional.of(type.cast(found));
        }
        return Optional.empty();
    }

    @Override
    public synchronized void commit(UnitOfWork work) throws PersistenceException {
        verify(work);
        for (Dimension dimension : work.getCreated()) {
            dimension.assignId(dimensionIds.incrementAndGet());
            dimensions.put(dimension.naturalKey(), dimension);
        }
        ResultFact fact = work.getFact();
        fact.assignId(factIds.incrementAndGet());
        facts.add(fact);
        log.debug("Committed {} new dimension(s) and fact {}", work.getCreated().size(), fact.getId());
    }

    /**
     * Rejects the unit before anything is written, so a failed commit leaves the store untouched.
     */
    private void verify(UnitOfWork work) throws PersistenceException {
        ResultFact fact = work.getFact();
        if (fact == null) {
            throw new PersistenceException("Unit of work carries no fact");
        }
        if (!fact.isValid()) {
            throw new PersistenceException("Fact references invalid dimensions");
        }
        Set<Dimension> created = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Dimension dimension : work.getCreated()) {
            if (!dimension.isValid()) {
                throw new PersistenceException("Invalid dimension " + dimension);
            }
            if (dimension.isPersisted() || dimensions.containsKey(dimension.naturalKey())) {
                throw new PersistenceException("Duplicate natural key " + dimension.naturalKey());
            }
            if (!created.add(dimension)) {
                throw new PersistenceException("Dimension queued twice " + dimension);
            }
        }
        for (Dimension dimension : fact.dimensions()) {
            if (!dimension.isPersisted() && !created.contains(dimension)) {
                throw new PersistenceException("Fact references unresolved dimension " + dimension);
            }
        }
    }

    @Override
    public synchronized List<ResultRecord> findResults(String plan, Instant from, Instant to) {
        List<ResultFact> matching = new ArrayList<>();
        for (ResultFact fact : facts) {
            Instant timestamp = fact.getTimestamp();
            if (fact.getPlan().getName().equals(plan)
                    && !timestamp.isBefore(from)
                    && !timestamp.isAfter(to)) {
                matching.add(fact);
            }
        }
        // List.sort is stable, so equal timestamps keep insertion order
        matching.sort(Comparator.comparing(ResultFact::getTimestamp));
        List<ResultRecord> records = new ArrayList<>(matching.size());
        for (ResultFact fact : matching) {
            records.add(fact.toRecord());
        }
        return records;
    }

    @Override
    public synchronized long countResults() {
        return facts.size();
    }

    @Override
    public synchronized long countDimensions(DimensionType type) {
        return dimensions.values().stream().filter(d -> d.type() == type).count();
    }
}
