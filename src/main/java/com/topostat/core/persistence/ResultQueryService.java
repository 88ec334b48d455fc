package com.topostat.core.persistence;

import com.topostat.core.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-side queries over the result store used by the statistics pass,
 * the CLI and health checks.
 */
@Service
public class ResultQueryService {

    private static final Logger log = LoggerFactory.getLogger(ResultQueryService.class);

    private final ResultStore store;

    public ResultQueryService(ResultStore store) {
        this.store = store;
    }

    /**
     * Results of one plan inside the closed window {@code [from, to]}, oldest first.
     */
    public List<ResultRecord> findResults(String plan, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
        List<ResultRecord> results = store.findResults(plan, from, to);
        log.info("Fetched {} result(s) of plan '{}' between {} and {}", results.size(), plan, from, to);
        return results;
    }

    public long countResults() {
        return store.countResults();
    }

    /** Row count per dimension table, in resolution order. */
    public Map<DimensionType, Long> countDimensions() {
        Map<DimensionType, Long> counts = new EnumMap<>(DimensionType.class);
        for (DimensionType type : DimensionType.values()) {
            counts.put(type, store.countDimensions(type));
        }
        return counts;
    }

    /** Short description of the backing store for health output. */
    public String storeKind() {
        return store instanceof JdbcResultStore ? "jdbc" : "memory";
    }
}
