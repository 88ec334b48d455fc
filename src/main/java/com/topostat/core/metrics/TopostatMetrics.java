package com.topostat.core.metrics;

import com.topostat.core.error.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for ingestion, uploads and reporting.
 */
@Service
public class TopostatMetrics {

    private final MeterRegistry registry;

    public TopostatMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordEnvelopeAccepted() {
        Counter.builder("topostat.envelopes.total")
                .tag("status", "accepted")
                .register(registry)
                .increment();
    }

    /**
     * Records an envelope discarded as a whole, before any record was processed.
     *
     * @param reason {@link ErrorKind#STRUCTURAL} or {@link ErrorKind#AUTH}
     */
    public void recordEnvelopeRejected(ErrorKind reason) {
        Counter.builder("topostat.envelopes.total")
                .tag("status", "rejected")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordRecordStored() {
        Counter.builder("topostat.records.total")
                .tag("status", "stored")
                .register(registry)
                .increment();
    }

    public void recordRecordInvalid(ErrorKind reason) {
        Counter.builder("topostat.records.total")
                .tag("status", "invalid")
                .tag("reason", reason.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordBatchSize(int records) {
        DistributionSummary.builder("topostat.envelope.records")
                .description("Result records per envelope")
                .register(registry)
                .record(records);
    }

    public void recordIngestDuration(long ms) {
        Timer.builder("topostat.ingest.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordQueueRejected() {
        Counter.builder("topostat.queue.rejected")
                .description("Envelopes refused because the ingestion queue was full")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "sent", "failed" or "timeout"
     */
    public void recordUpload(String outcome) {
        Counter.builder("topostat.uploads.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordReportDuration(long ms) {
        Timer.builder("topostat.report.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
