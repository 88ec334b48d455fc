package com.topostat.core.stats;

import com.topostat.config.TopostatProperties;
import com.topostat.core.metrics.TopostatMetrics;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.persistence.ResultQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs the on-demand statistics pass: reads a plan's window from the store and
 * aggregates it. Reads only, so it never interleaves with ingestion locking.
 */
@Service
public class StatisticsService {

    private static final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    private final ResultQueryService queryService;
    private final TopostatMetrics metrics;
    private final AggregationEngine engine;
    private final int defaultDays;

    public StatisticsService(ResultQueryService queryService, TopostatProperties properties,
                             TopostatMetrics metrics) {
        this.queryService = queryService;
        this.metrics = metrics;
        this.engine = new AggregationEngine(ReportPolicy.from(properties.report()));
        this.defaultDays = properties.report().defaultDays();
    }

    /** Report over the configured number of days up to now. */
    public ReportModel lastDays(String plan, int days) {
        Instant to = Instant.now();
        return compute(plan, to.minus(Duration.ofDays(days > 0 ? days : defaultDays)), to);
    }

    public ReportModel compute(String plan, Instant from, Instant to) {
        long start = System.currentTimeMillis();
        List<ResultRecord> results = queryService.findResults(plan, from, to);
        if (results.isEmpty()) {
            log.warn("No results of plan '{}' between {} and {}", plan, from, to);
        }
        ReportModel model = engine.computeReport(plan, from, to, results, queryService.countResults());
        metrics.recordReportDuration(System.currentTimeMillis() - start);
        return model;
    }

    public int getDefaultDays() {
        return defaultDays;
    }
}
