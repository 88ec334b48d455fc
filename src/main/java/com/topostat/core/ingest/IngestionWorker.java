package com.topostat.core.ingest;

import com.topostat.config.TopostatProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls every {@link EnvelopeSource} from its own thread and hands envelopes to the
 * {@link IngestionService}. Only active when the collector runs as a web application.
 * <p>
 * Polls use a bounded timeout, so a stop request takes effect within one poll interval.
 */
@Component
@ConditionalOnWebApplication
public class IngestionWorker {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final List<EnvelopeSource> sources;
    private final IngestionService ingestionService;
    private final Duration pollTimeout;
    private final boolean authKeyConfigured;

    private volatile boolean running;
    private ExecutorService executor;

    public IngestionWorker(List<EnvelopeSource> sources, IngestionService ingestionService,
                           TopostatProperties properties) {
        this.sources = sources;
        this.ingestionService = ingestionService;
        this.pollTimeout = properties.collector().pollTimeout();
        this.authKeyConfigured = properties.collector().hasAuthKey();
    }

    @PostConstruct
    void start() {
        if (!authKeyConfigured) {
            log.warn("No collector auth key configured (topostat.collector.auth-key); every envelope will be rejected");
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(Math.max(1, sources.size()), r -> {
            Thread t = new Thread(r, "ingest-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;
        for (EnvelopeSource source : sources) {
            executor.submit(() -> pollLoop(source));
        }
        log.info("Ingestion worker started ({} source(s), poll timeout {})", sources.size(), pollTimeout);
    }

    @PreDestroy
    void stop() {
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(pollTimeout.toMillis() + 5000, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Ingestion worker stopped");
    }

    public boolean isRunning() {
        return running && executor != null && !executor.isShutdown();
    }

    private void pollLoop(EnvelopeSource source) {
        log.debug("Polling envelope source '{}'", source.name());
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                Optional<String> raw = source.poll(pollTimeout);
                raw.ifPresent(ingestionService::ingest);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Unexpected failure ingesting from '{}'", source.name(), e);
            }
        }
        log.debug("Stopped polling envelope source '{}'", source.name());
    }
}
