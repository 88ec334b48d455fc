package com.topostat.core.health;

import com.topostat.config.TopostatProperties;
import com.topostat.core.ingest.IngestionWorker;
import com.topostat.core.ingest.QueueEnvelopeSource;
import com.topostat.core.persistence.ResultQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ResultQueryService queryService;
    private final TopostatProperties properties;
    private final DataSource dataSource;
    private final IngestionWorker ingestionWorker;
    private final QueueEnvelopeSource queue;

    public HealthCheckService(
            ResultQueryService queryService,
            TopostatProperties properties,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) IngestionWorker ingestionWorker,
            @Autowired(required = false) QueueEnvelopeSource queue) {
        this.queryService = queryService;
        this.properties = properties;
        this.dataSource = dataSource;
        this.ingestionWorker = ingestionWorker;
        this.queue = queue;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkDatabase());
        results.add(checkIngestion());
        return results;
    }

    private HealthStatus checkStore() {
        try {
            long results = queryService.countResults();
            var metadata = new LinkedHashMap<String, String>();
            metadata.put("kind", queryService.storeKind());
            metadata.put("results", String.valueOf(results));
            queryService.countDimensions()
                    .forEach((type, count) -> metadata.put(type.tableName(), String.valueOf(count)));
            return new HealthStatus("store", HealthStatus.Status.UP,
                    queryService.storeKind() + " store holding " + results + " result(s)", metadata);
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; results are kept in memory", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkIngestion() {
        if (!properties.collector().hasAuthKey()) {
            return new HealthStatus("ingestion", HealthStatus.Status.DEGRADED,
                    "No collector auth key configured; all envelopes are rejected", Map.of());
        }
        if (ingestionWorker == null) {
            return new HealthStatus("ingestion", HealthStatus.Status.DEGRADED,
                    "Ingestion worker not active (collector not serving)", Map.of());
        }
        if (!ingestionWorker.isRunning()) {
            return new HealthStatus("ingestion", HealthStatus.Status.DOWN,
                    "Ingestion worker stopped", Map.of());
        }
        String backlog = queue != null ? String.valueOf(queue.size()) : "0";
        return new HealthStatus("ingestion", HealthStatus.Status.UP,
                "Ingestion worker running, " + backlog + " envelope(s) queued",
                Map.of("queued", backlog));
    }
}
