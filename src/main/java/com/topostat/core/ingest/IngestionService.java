package com.topostat.core.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.topostat.config.TopostatProperties;
import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;
import com.topostat.core.logging.MdcContext;
import com.topostat.core.message.EnvelopeCodec;
import com.topostat.core.message.MessageEnvelope;
import com.topostat.core.message.ResultRecordCodec;
import com.topostat.core.metrics.TopostatMetrics;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.model.WireFormat;
import com.topostat.core.normalize.BatchContext;
import com.topostat.core.normalize.Normalizer;
import com.topostat.core.persistence.PersistenceException;
import com.topostat.core.persistence.ResultStore;
import com.topostat.core.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authenticates an envelope and turns each contained record into a committed fact.
 * <p>
 * Envelopes are processed one at a time under a single lock, so no two batches mutate
 * the dimension tables concurrently. Structural and authentication failures discard the
 * whole envelope; any failure of a single record discards only that record. Each record
 * commits on its own, so a failed commit never rolls back earlier records of the batch.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final EnvelopeCodec envelopeCodec;
    private final ResultRecordCodec recordCodec;
    private final Normalizer normalizer;
    private final ResultStore store;
    private final TopostatMetrics metrics;
    private final String secret;
    private final boolean authKeyConfigured;

    public IngestionService(EnvelopeCodec envelopeCodec, ResultRecordCodec recordCodec,
                            Normalizer normalizer, ResultStore store,
                            TopostatProperties properties, TopostatMetrics metrics) {
        this.envelopeCodec = envelopeCodec;
        this.recordCodec = recordCodec;
        this.normalizer = normalizer;
        this.store = store;
        this.metrics = metrics;
        this.secret = properties.collector().authKey();
        this.authKeyConfigured = properties.collector().hasAuthKey();
    }

    public IngestReport ingest(String rawEnvelope) {
        lock.lock();
        long start = System.currentTimeMillis();
        try {
            return process(rawEnvelope);
        } finally {
            metrics.recordIngestDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
            lock.unlock();
        }
    }

    private IngestReport process(String rawEnvelope) {
        Attempt<MessageEnvelope> decoded = envelopeCodec.decode(rawEnvelope);
        if (!decoded.isOk()) {
            return reject(null, decoded.error(), decoded.message());
        }
        MessageEnvelope envelope = decoded.value();
        String envelopeId = envelope.getTimestamp() != null ? WireFormat.format(envelope.getTimestamp()) : null;
        if (envelopeId != null) {
            MdcContext.setEnvelope(envelopeId);
        }
        if (!envelope.check()) {
            return reject(envelopeId, ErrorKind.STRUCTURAL, "Envelope failed structural check");
        }
        if (!authKeyConfigured) {
            return reject(envelopeId, ErrorKind.AUTH, "No collector auth key configured");
        }
        if (!envelope.verifyAuth(secret)) {
            return reject(envelopeId, ErrorKind.AUTH, "Envelope authentication failed");
        }

        metrics.recordEnvelopeAccepted();
        metrics.recordBatchSize(envelope.getPayload().size());

        BatchContext batch = new BatchContext();
        Map<ErrorKind, Integer> invalid = new EnumMap<>(ErrorKind.class);
        int stored = 0;
        int index = 0;
        for (JsonNode node : envelope.getPayload()) {
            index++;
            Attempt<Long> outcome = ingestRecord(node, batch);
            if (outcome.isOk()) {
                stored++;
                metrics.recordRecordStored();
            } else {
                invalid.merge(outcome.error(), 1, Integer::sum);
                metrics.recordRecordInvalid(outcome.error());
                log.warn("Discarded record {} of envelope: {} {}", index, outcome.error(), outcome.message());
            }
            MdcContext.clearRecord();
        }

        IngestReport report = new IngestReport(envelopeId, null, null,
                envelope.getPayload().size(), stored, invalid);
        log.info("Ingested envelope: {} record(s) received, {} stored, {} invalid",
                report.received(), report.stored(), report.invalidCount());
        return report;
    }

    /**
     * Decodes, normalizes and commits one record.
     *
     * @return the id of the stored fact
     */
    private Attempt<Long> ingestRecord(JsonNode node, BatchContext batch) {
        Attempt<ResultRecord> record = recordCodec.fromJson(node);
        if (record.isOk()) {
            MdcContext.setRecord(record.value().agentName(), record.value().planName());
        }
        Attempt<UnitOfWork> work = record.flatMap(r -> normalizer.normalize(r, batch));
        if (!work.isOk()) {
            return Attempt.fail(work.error(), work.message());
        }
        try {
            store.commit(work.value());
            return Attempt.ok(work.value().getFact().getId());
        } catch (PersistenceException e) {
            batch.evict(work.value());
            log.error("Failed to persist record '{}'", record.value().name(), e);
            return Attempt.fail(ErrorKind.PERSISTENCE, e.getMessage());
        }
    }

    private IngestReport reject(String envelopeId, ErrorKind kind, String message) {
        metrics.recordEnvelopeRejected(kind);
        log.warn("Rejected envelope: {} {}", kind, message);
        return IngestReport.rejected(envelopeId, kind, message);
    }
}
