package com.topostat.core.ingest;

import com.topostat.config.TopostatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded in-process queue between the HTTP ingestion endpoint and the {@link IngestionWorker}.
 */
@Component
public class QueueEnvelopeSource implements EnvelopeSource {

    private static final Logger log = LoggerFactory.getLogger(QueueEnvelopeSource.class);

    private final String name;
    private final BlockingQueue<String> queue;

    @Autowired
    public QueueEnvelopeSource(TopostatProperties properties) {
        this("http", properties.collector().queueCapacity());
    }

    QueueEnvelopeSource(String name, int capacity) {
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Enqueues an envelope without blocking.
     *
     * @return false when the queue is full
     */
    public boolean offer(String rawEnvelope) {
        boolean queued = queue.offer(rawEnvelope);
        if (!queued) {
            log.warn("Ingestion queue '{}' full, envelope refused", name);
        }
        return queued;
    }

    @Override
    public Optional<String> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public int size() {
        return queue.size();
    }

    public int remainingCapacity() {
        return queue.remainingCapacity();
    }
}
