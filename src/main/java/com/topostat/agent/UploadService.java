package com.topostat.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.topostat.config.TopostatProperties;
import com.topostat.core.message.EnvelopeCodec;
import com.topostat.core.message.MessageEnvelope;
import com.topostat.core.message.ResultRecordCodec;
import com.topostat.core.metrics.TopostatMetrics;
import com.topostat.core.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps gathered records in one authenticated envelope and sends it under a watchdog.
 * <p>
 * If the send does not finish within {@code topostat.agent.connection-timeout} it is
 * aborted and reported as {@link Outcome#TIMED_OUT}. Uploads are never retried.
 */
@Service
public class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    public enum Outcome { SENT, NOTHING_TO_SEND, FAILED, TIMED_OUT }

    private final ResultRecordCodec recordCodec;
    private final EnvelopeCodec envelopeCodec;
    private final EnvelopeSink sink;
    private final TopostatMetrics metrics;
    private final String secret;
    private final Duration watchdog;

    public UploadService(ResultRecordCodec recordCodec, EnvelopeCodec envelopeCodec, EnvelopeSink sink,
                         TopostatProperties properties, TopostatMetrics metrics) {
        this.recordCodec = recordCodec;
        this.envelopeCodec = envelopeCodec;
        this.sink = sink;
        this.metrics = metrics;
        this.secret = properties.agent().authKey();
        this.watchdog = properties.agent().connectionTimeout();
    }

    public Outcome upload(List<ResultRecord> records) {
        return upload(records, sink, secret);
    }

    /**
     * Uploads through an explicit sink and secret, overriding the configured ones.
     */
    public Outcome upload(List<ResultRecord> records, EnvelopeSink sink, String secret) {
        if (records.isEmpty()) {
            log.info("No results to send");
            return Outcome.NOTHING_TO_SEND;
        }

        if (secret == null || secret.isEmpty()) {
            log.error("No agent auth key configured (topostat.agent.auth-key or --key); results not sent");
            metrics.recordUpload("failed");
            return Outcome.FAILED;
        }

        List<JsonNode> payload = new ArrayList<>(records.size());
        for (ResultRecord record : records) {
            payload.add(recordCodec.toJson(record));
        }
        MessageEnvelope envelope = new MessageEnvelope(payload);
        if (!envelope.generateAuth(secret) || !envelope.check()) {
            log.error("Failed to compose envelope");
            metrics.recordUpload("failed");
            return Outcome.FAILED;
        }
        String json = envelopeCodec.encode(envelope);

        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "upload");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<?> send = executor.submit(() -> {
                sink.send(json);
                return null;
            });
            log.info("Started upload watchdog timer with interval of {}", watchdog);
            try {
                send.get(watchdog.toMillis(), TimeUnit.MILLISECONDS);
                log.info("Sent {} test result(s) to collector", records.size());
                metrics.recordUpload("sent");
                return Outcome.SENT;
            } catch (TimeoutException e) {
                send.cancel(true);
                log.error("Upload watchdog timer expired after {}", watchdog);
                metrics.recordUpload("timeout");
                return Outcome.TIMED_OUT;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to send test results to collector: {}", cause.getMessage(), cause);
                metrics.recordUpload("failed");
                return Outcome.FAILED;
            } catch (InterruptedException e) {
                send.cancel(true);
                Thread.currentThread().interrupt();
                metrics.recordUpload("failed");
                return Outcome.FAILED;
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
