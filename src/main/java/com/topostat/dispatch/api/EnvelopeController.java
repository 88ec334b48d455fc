package com.topostat.dispatch.api;

import com.topostat.core.ingest.QueueEnvelopeSource;
import com.topostat.core.metrics.TopostatMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Ingestion endpoint agents post envelopes to.
 * <p>
 * Envelopes are only queued here; authentication and persistence happen on the
 * ingestion worker, so an accepted envelope may still be discarded later.
 */
@RestController
@RequestMapping("/api/v1/envelopes")
public class EnvelopeController {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeController.class);

    private final QueueEnvelopeSource queue;
    private final TopostatMetrics metrics;

    public EnvelopeController(QueueEnvelopeSource queue, TopostatMetrics metrics) {
        this.queue = queue;
        this.metrics = metrics;
    }

    /**
     * POST /api/v1/envelopes: Queue a raw envelope for ingestion.
     * Returns 202 when queued, 400 for an empty body, 503 when the queue is full.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> submit(@RequestBody(required = false) String body) {
        if (body == null || body.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Empty envelope"));
        }
        if (!queue.offer(body)) {
            metrics.recordQueueRejected();
            return ResponseEntity.status(503).body(Map.of("error", "Ingestion queue full"));
        }
        log.debug("Queued envelope ({} bytes, {} queued)", body.length(), queue.size());
        return ResponseEntity.accepted().body(Map.of("status", "queued"));
    }
}
